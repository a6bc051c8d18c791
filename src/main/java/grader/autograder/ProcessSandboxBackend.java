package grader.autograder;

import grader.Common;
import org.apache.commons.io.FileUtils;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Sandboxes that are private directories on the local machine, each graded by a child JVM running
 * {@link GradeWorker}. The image is a copy of the autograder bundle; each sandbox starts as a copy of the image.
 */
public class ProcessSandboxBackend implements SandboxBackend {

    static final String IMAGE_DIR = "image";
    static final String SUBMISSION_DIR = "submission";
    static final String CONSOLE_FILE = "console.txt";
    static final String ARTIFACTS_DIR = "artifacts";
    /** how much console output to keep in a failure diagnostic */
    private static final int CONSOLE_TAIL = 4096;

    private final static Logger LOG = Logger.getLogger("ProcessSandboxBackend");

    private final Path bundleDir;
    private final Path workRoot;
    private final GraderConfig config;
    /** where artifacts get copied, one subdirectory per submission. null to not collect artifacts */
    @Nullable
    private final Path artifactsOut;

    private volatile Path image = null;

    public ProcessSandboxBackend(Path bundleDir, Path workRoot, GraderConfig config, @Nullable Path artifactsOut) {
        this.bundleDir = bundleDir;
        this.workRoot = workRoot;
        this.config = config;
        this.artifactsOut = artifactsOut;
    }

    @Override
    public void prepare() throws SandboxLaunchException {
        if (!Files.isDirectory(bundleDir.resolve(AutograderBundle.TESTS_DIR))) {
            throw new SandboxLaunchException("autograder bundle " + bundleDir + " is missing or has no " +
                    AutograderBundle.TESTS_DIR + "/ directory");
        }
        final Path img = workRoot.resolve(IMAGE_DIR);
        try {
            Files.createDirectories(workRoot);
            FileUtils.deleteDirectory(img.toFile());
            FileUtils.copyDirectory(bundleDir.toFile(), img.toFile());
        } catch (IOException e) {
            throw new SandboxLaunchException("couldn't build sandbox image in " + img, e);
        }
        image = img;
        LOG.info("built sandbox image " + img);
    }

    @Override
    public Sandbox acquire(SubmissionJob job, boolean debug) throws SandboxLaunchException {
        final Path img = image;
        if (null == img) {
            throw new SandboxLaunchException("sandbox image hasn't been built");
        }
        try {
            Path dir = Files.createTempDirectory(workRoot, "sandbox-" + job.index + "-");
            FileUtils.copyDirectory(img.toFile(), dir.toFile());
            LOG.fine(String.format("sandbox %s for %s", dir, job.key));
            return new ProcessSandbox(job, dir, debug);
        } catch (IOException e) {
            throw new SandboxLaunchException("couldn't create a sandbox in " + workRoot, e);
        }
    }

    @Override
    public void dispose() {
        final Path img = image;
        if (null != img) {
            FileUtils.deleteQuietly(img.toFile());
            image = null;
        }
    }

    /** the command line that grades submission inside sandboxDir */
    List<String> workerCommand(Path sandboxDir, Path submission) {
        final String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        return new ArrayList<>(Arrays.asList(java, "-enableassertions",
                "-cp", System.getProperty("java.class.path"),
                GradeWorker.class.getName(),
                "--submission", submission.toString(),
                "--sandbox-dir", sandboxDir.toString(),
                "--case-timeout", Long.toString(config.caseTimeout.getSeconds()),
                "--default-points", Double.toString(config.testDefaults.points),
                "--all-or-nothing", Boolean.toString(config.testDefaults.allOrNothing)));
    }

    class ProcessSandbox implements Sandbox {
        private final SubmissionJob job;
        private final Path dir;
        private final boolean debug;

        ProcessSandbox(SubmissionJob job, Path dir, boolean debug) {
            this.job = job;
            this.dir = dir;
            this.debug = debug;
        }

        @Override
        public String id() {
            return dir.getFileName().toString();
        }

        @Override
        public void run() throws SandboxExecutionException, InterruptedException {
            final Path submission = dir.resolve(SUBMISSION_DIR).resolve(job.path.getFileName());
            try {
                Files.createDirectories(submission.getParent());
                Files.copy(job.path, submission);
            } catch (IOException e) {
                throw new SandboxExecutionException("couldn't copy submission " + job.path + " into sandbox", e);
            }

            ProcessBuilder pb = new ProcessBuilder(workerCommand(dir, submission));
            pb.directory(dir.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.to(console()));

            final Process p;
            try {
                p = pb.start();
            } catch (IOException e) {
                throw new SandboxExecutionException("couldn't start grade worker", e);
            }

            try {
                if (!p.waitFor(config.sandboxTimeout.getSeconds(), TimeUnit.SECONDS)) {
                    Common.destroyProcessTree(p);
                    throw new SandboxExecutionException(String.format("grading timed out after %d seconds",
                            config.sandboxTimeout.getSeconds()), consoleTail());
                }
            } catch (InterruptedException e) {
                Common.destroyProcessTree(p);
                throw e;
            }

            final int exitCode = p.exitValue();
            if (0 != exitCode) {
                throw new SandboxExecutionException("grade worker exited with code " + exitCode, consoleTail());
            }
        }

        @Override
        public SubmissionResult collect() throws SandboxExecutionException {
            final Path results = dir.resolve(GradeWorker.RESULTS_FILE);
            if (!Files.isRegularFile(results)) {
                throw new SandboxExecutionException("grade worker produced no " + GradeWorker.RESULTS_FILE, consoleTail());
            }

            final WorkerReport report;
            try {
                report = GradeWorker.readReport(results);
            } catch (IOException | IllegalArgumentException e) {
                throw new SandboxExecutionException("couldn't parse " + GradeWorker.RESULTS_FILE, e);
            }
            if (null != report.error) {
                throw new SandboxExecutionException(report.error, consoleTail());
            }

            Map<String, Double> scores = new LinkedHashMap<>();
            if (null != report.testFiles) {
                for (WorkerReport.TestFileReport tfr : report.testFiles) {
                    Double v = ScoreMode.POINTS == config.scoreMode ? tfr.pointsEarned : tfr.grade;
                    scores.put(tfr.name, null == v ? 0.0 : v);
                }
            }

            String consoleOutput = null;
            if (debug) {
                try {
                    consoleOutput = FileUtils.readFileToString(console(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    LOG.warning(Common.t2s(e, "couldn't read console output of " + id()));
                }
            }

            return SubmissionResult.graded(scores, consoleOutput, copyArtifacts());
        }

        @Override
        public void release() {
            try {
                FileUtils.deleteDirectory(dir.toFile());
            } catch (IOException e) {
                LOG.warning(Common.t2s(e, "couldn't delete sandbox " + dir));
            }
        }

        private List<Path> copyArtifacts() throws SandboxExecutionException {
            final File src = dir.resolve(ARTIFACTS_DIR).toFile();
            if (null == artifactsOut || !src.isDirectory()) {
                return Collections.emptyList();
            }
            final File dest = artifactsOut.resolve(job.key).toFile();
            try {
                FileUtils.copyDirectory(src, dest);
            } catch (IOException e) {
                throw new SandboxExecutionException("couldn't copy artifacts out of " + id(), e);
            }
            Collection<File> files = FileUtils.listFiles(dest, null, true);
            List<Path> paths = new ArrayList<>(files.size());
            for (File f : files) {
                paths.add(f.toPath());
            }
            Collections.sort(paths);
            return paths;
        }

        private File console() {
            return dir.resolve(CONSOLE_FILE).toFile();
        }

        private String consoleTail() {
            try {
                return Common.tailOfFile(CONSOLE_TAIL, console());
            } catch (IOException e) {
                return "couldn't read console output: " + e;
            }
        }
    }
}
