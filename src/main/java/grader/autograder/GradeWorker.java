package grader.autograder;

import com.google.api.client.json.gson.GsonFactory;
import grader.Common;
import grader.testfiles.ExecutionContext;
import grader.testfiles.GradeComputer;
import grader.testfiles.PointAllocationException;
import grader.testfiles.TestFile;
import grader.testfiles.TestFileDefaults;
import grader.testfiles.TestFileSummary;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Runs inside a sandbox: grades one submission against the test files in the sandbox's tests/ directory and writes a
 * {@link WorkerReport} to results.json in the sandbox directory.
 *
 * Exit codes: 0 if the report was written, 1 if the test files are misconfigured (the report carries the error),
 * 2 for bad arguments or I/O errors.
 */
public class GradeWorker {

    static final String RESULTS_FILE = "results.json";
    static final String LOG_FILE = "GradeWorker.log";

    final static Logger LOG = Logger.getLogger("GradeWorker");

    private static final OptionSpec<File> Submission;
    private static final OptionSpec<File> SandboxDir;
    private static final OptionSpec<Integer> CaseTimeout;
    private static final OptionSpec<Double> DefaultPoints;
    private static final OptionSpec<Boolean> AllOrNothing;
    private static final OptionSpec<Void> Help;
    private static final OptionParser Parser;

    static {
        Parser = new OptionParser();
        Submission = Parser.accepts("submission", "File submitted by student").withRequiredArg().ofType(File.class).required();
        SandboxDir = Parser.accepts("sandbox-dir", "Directory in which to grade this submission").withRequiredArg().ofType(File.class).required();
        CaseTimeout = Parser.accepts("case-timeout", "Seconds a single test case may run").withRequiredArg().ofType(Integer.class).defaultsTo(60);
        DefaultPoints = Parser.accepts("default-points", "Value of a test file that doesn't specify one").withRequiredArg().ofType(Double.class).defaultsTo(1.0);
        AllOrNothing = Parser.accepts("all-or-nothing", "Grade test files all-or-nothing unless they say otherwise").withRequiredArg().ofType(Boolean.class).defaultsTo(true);
        Help = Parser.accepts("help", "Print this help message").forHelp();
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        final OptionSet options;
        try {
            options = Parser.parse(args);
        } catch (OptionException e) {
            System.err.println(e.getMessage());
            printHelp();
            return 2;
        }
        if (options.has(Help)) {
            printHelp();
            return 0;
        }

        final Path sandboxDir = options.valueOf(SandboxDir).toPath();
        final Path submission = options.valueOf(Submission).toPath();
        if (!Files.isDirectory(sandboxDir)) {
            System.err.println("not a directory: " + sandboxDir);
            return 2;
        }

        // log all messages to disk
        LOG.setLevel(Level.ALL);
        try {
            FileHandler fh = new FileHandler(sandboxDir.resolve(LOG_FILE).toString(), true);
            fh.setFormatter(new SimpleFormatter());
            fh.setLevel(Level.ALL);
            LOG.addHandler(fh); // NB: we also log to the console
        } catch (IOException e) {
            System.err.println(Common.t2s(e, "couldn't open " + LOG_FILE));
            return 2;
        }

        final TestFileDefaults defaults = new TestFileDefaults(options.valueOf(DefaultPoints), options.valueOf(AllOrNothing));
        final Duration caseTimeout = Duration.ofSeconds(options.valueOf(CaseTimeout));

        WorkerReport report;
        int rc = 0;
        try {
            report = grade(sandboxDir, submission, defaults, caseTimeout);
        } catch (PointAllocationException e) {
            LOG.severe(e.getMessage());
            report = new WorkerReport(submission.getFileName().toString(), null, e.getMessage());
            rc = 1;
        } catch (IOException e) {
            LOG.severe(Common.t2s(e, "error loading test files"));
            return 2;
        }

        try {
            writeReport(report, sandboxDir.resolve(RESULTS_FILE));
        } catch (IOException e) {
            LOG.severe(Common.t2s(e, "Converting WorkerReport to json"));
            return 2;
        }
        return rc;
    }

    /**
     * Grade a submission against every test file in sandboxDir/tests
     * @param sandboxDir the directory test cases run in
     * @param submission the submitted file
     * @param defaults for test files that don't give a total value or all-or-nothing policy
     * @param caseTimeout how long each test case may run
     */
    public static WorkerReport grade(Path sandboxDir, Path submission, TestFileDefaults defaults, Duration caseTimeout)
            throws IOException, PointAllocationException {
        List<TestFile> testFiles = AutograderBundle.loadTestFiles(sandboxDir, defaults);
        LOG.info(String.format("grading %s against %d test files", submission.getFileName(), testFiles.size()));

        final ExecutionContext ctx = new ExecutionContext(sandboxDir, submission, caseTimeout);
        WorkerReport.TestFileReport[] reports = new WorkerReport.TestFileReport[testFiles.size()];
        for (int i = 0; i < reports.length; i++) {
            TestFile tf = testFiles.get(i);
            GradeComputer.forFormat(tf.format).run(tf, ctx);
            LOG.info(TestFileSummary.plain(tf, true));
            System.out.println(TestFileSummary.plain(tf, false));
            reports[i] = new WorkerReport.TestFileReport(tf);
        }
        return new WorkerReport(submission.getFileName().toString(), reports, null);
    }

    static void writeReport(WorkerReport report, Path f) throws IOException {
        String json = GsonFactory.getDefaultInstance().toPrettyString(report);
        Files.write(f, json.getBytes(StandardCharsets.UTF_8));
        LOG.fine("JSON response: " + json);
    }

    static WorkerReport readReport(Path f) throws IOException {
        String json = new String(Files.readAllBytes(f), StandardCharsets.UTF_8);
        return GsonFactory.getDefaultInstance().createJsonParser(json).parse(WorkerReport.class);
    }

    private static void printHelp() {
        try {
            Parser.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }
}
