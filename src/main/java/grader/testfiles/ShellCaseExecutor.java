package grader.testfiles;

import grader.Common;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs a test case body as a bash command in the execution context's working directory. The case passes if the
 * command exits with status 0. stdout and stderr go to a file under case-output/, and the tail of that file is
 * reported back.
 */
public class ShellCaseExecutor implements CaseExecutor {

    final static Logger LOG = Logger.getLogger("ShellCaseExecutor");

    /** how much of a case's output we report back, in bytes */
    static final int OUTPUT_TAIL = 1024;
    static final String OUTPUT_DIR = "case-output";

    @Override
    public CaseOutcome execute(TestCase testCase, ExecutionContext ctx) throws IOException, InterruptedException {
        Path outDir = ctx.workingDir.resolve(OUTPUT_DIR);
        Files.createDirectories(outDir);
        String prefix = testCase.name.replaceAll("[^A-Za-z0-9._-]", "_") + "-";
        File outF = Files.createTempFile(outDir, prefix, ".out").toFile();

        ProcessBuilder pb = new ProcessBuilder("bash", "-c", testCase.body);
        pb.directory(ctx.workingDir.toFile());
        pb.environment().putAll(ctx.environment);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.to(outF));
        LOG.finest("running test case " + testCase.name + ": " + testCase.body);

        final Process p = pb.start();
        final boolean exited;
        try {
            exited = p.waitFor(ctx.caseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Common.destroyProcessTree(p);
            throw e;
        }

        if (!exited) {
            Common.destroyProcessTree(p);
            LOG.info(String.format("test case %s timed out after %ds", testCase.name, ctx.caseTimeout.getSeconds()));
            return CaseOutcome.fail(String.format("timed out after %d seconds%n%s",
                    ctx.caseTimeout.getSeconds(), Common.tailOfFile(OUTPUT_TAIL, outF)));
        }

        final String output = Common.tailOfFile(OUTPUT_TAIL, outF);
        if (0 != p.exitValue()) {
            return CaseOutcome.fail(String.format("exited with code %d%n%s", p.exitValue(), output));
        }
        return CaseOutcome.pass(output);
    }
}
