package grader.autograder;

import grader.Common;
import grader.results.AggregationSchemaException;
import grader.results.CsvIdentifierResolver;
import grader.results.FinalGradeTable;
import grader.results.IdentifierResolver;
import grader.testfiles.PointAllocationException;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command-line entry point: grades every submission in a directory against an autograder bundle and writes
 * final_grades.csv to the output directory.
 */
public class GradeCoordinator {

    static final String OUTPUT_FILE = "final_grades.csv";
    static final String LOG_FILE = "GradeCoordinator.log";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ALLOCATION = 3;
    static final int EXIT_LAUNCH = 4;
    static final int EXIT_AGGREGATION = 5;

    /** how long a shutdown waits for an interrupted batch to release its sandboxes */
    static final long SHUTDOWN_GRACE_MILLIS = 30_000;

    private final static Logger LOG = Logger.getLogger("GradeCoordinator");

    private static final OptionSpec<File> SubmissionsPath;
    private static final OptionSpec<File> OutputDir;
    private static final OptionSpec<File> Autograder;
    private static final OptionSpec<Integer> Containers;
    private static final OptionSpec<Void> NoKill;
    private static final OptionSpec<Void> Debug;
    private static final OptionSpec<File> Ids;
    private static final OptionSpec<Void> Points;
    private static final OptionSpec<File> ConfigFile;
    private static final OptionSpec<Void> Artifacts;
    private static final OptionSpec<Void> Verbose;
    private static final OptionSpec<Void> Help;
    private static final OptionParser Parser;

    static {
        Parser = new OptionParser();
        SubmissionsPath = Parser.accepts("path", "Directory of submissions, one file per submission").withRequiredArg().ofType(File.class).required();
        Autograder = Parser.accepts("autograder", "Autograder bundle: a directory or .zip with a tests/ directory").withRequiredArg().ofType(File.class).required();
        OutputDir = Parser.accepts("output-dir", "Where to write " + OUTPUT_FILE + " and logs").withRequiredArg().ofType(File.class).defaultsTo(new File("."));
        Containers = Parser.accepts("containers", "Max number of sandboxes to run at once").withRequiredArg().ofType(Integer.class);
        NoKill = Parser.accepts("no-kill", "Keep sandboxes around after grading, for debugging");
        Debug = Parser.accepts("debug", "Log the console output of every sandbox");
        Ids = Parser.accepts("ids", "CSV file with file,identifier columns; rows are keyed by identifier").withRequiredArg().ofType(File.class);
        Points = Parser.accepts("points", "Report points earned instead of the fraction of each test file passed");
        ConfigFile = Parser.accepts("config", "Properties file overriding the bundled grader.properties").withRequiredArg().ofType(File.class);
        Artifacts = Parser.accepts("artifacts", "Copy each sandbox's artifacts/ directory into the output directory");
        Verbose = Parser.accepts("verbose", "Log more details");
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
            return EXIT_USAGE;
        }
        if (options.has(Help)) {
            printHelp();
            return EXIT_OK;
        }

        final Path outputDir = options.valueOf(OutputDir).toPath().toAbsolutePath();
        try {
            Files.createDirectories(outputDir);
            setupLogging(outputDir, options.has(Verbose));
        } catch (IOException e) {
            System.err.println(Common.t2s(e, "couldn't set up output directory " + outputDir));
            return EXIT_ERROR;
        }
        LOG.info("LocalGrade " + Common.VERSION);

        GraderConfig config;
        try {
            Properties props = Common.loadProperties(options.valueOf(ConfigFile));
            config = GraderConfig.fromProperties(props);
            if (options.has(Containers)) {
                config = config.withContainers(options.valueOf(Containers));
            }
            if (options.has(Points)) {
                config = config.withScoreMode(ScoreMode.POINTS);
            }
            if (options.has(NoKill)) {
                config = config.withKeepAlive(true);
            }
            if (options.has(Debug)) {
                config = config.withDebug(true);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOG.severe("invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        LOG.info("configuration: " + config);

        Path workRoot = null;
        Thread shutdownHook = null;
        final CountDownLatch batchDone = new CountDownLatch(1);
        try {
            workRoot = Files.createTempDirectory("localgrade-");
            shutdownHook = cancellationHook(Thread.currentThread(), batchDone, workRoot, config.keepAlive,
                    SHUTDOWN_GRACE_MILLIS);
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            Path bundleDir = options.valueOf(Autograder).toPath();
            if (Files.isRegularFile(bundleDir) && "zip".equalsIgnoreCase(FilenameUtils.getExtension(bundleDir.toString()))) {
                bundleDir = AutograderBundle.unpack(bundleDir, workRoot.resolve("bundle"));
            }

            IdentifierResolver resolver = null;
            if (options.has(Ids)) {
                CsvIdentifierResolver csv = CsvIdentifierResolver.load(options.valueOf(Ids).toPath());
                LOG.info(String.format("loaded %d identifiers from %s", csv.size(), options.valueOf(Ids)));
                resolver = csv;
            }

            final Path artifactsOut = options.has(Artifacts) ? outputDir.resolve(ProcessSandboxBackend.ARTIFACTS_DIR) : null;
            SandboxBackend backend = new ProcessSandboxBackend(bundleDir, workRoot, config, artifactsOut);
            GradingBatch batch = new GradingBatch(config, backend, bundleDir, resolver);

            FinalGradeTable table = batch.run(options.valueOf(SubmissionsPath).toPath());
            final Path out = outputDir.resolve(OUTPUT_FILE);
            table.writeCsv(out);
            LOG.info(String.format("wrote %d rows to %s", table.getRows().size(), out));
            for (FinalGradeTable.Row row : table.getRows()) {
                if (null != row.diagnostic) {
                    LOG.warning(row.key + ": " + row.diagnostic);
                }
            }
            return EXIT_OK;

        } catch (PointAllocationException e) {
            LOG.severe("autograder bundle is misconfigured: " + e.getMessage());
            return EXIT_ALLOCATION;
        } catch (SandboxLaunchException e) {
            LOG.severe(Common.t2s(e, "couldn't launch sandboxes, no grades written"));
            return EXIT_LAUNCH;
        } catch (AggregationSchemaException e) {
            LOG.severe(Common.t2s(e, "couldn't merge results, no grades written"));
            return EXIT_AGGREGATION;
        } catch (IOException e) {
            LOG.severe(Common.t2s(e, "I/O error"));
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.severe("interrupted, no grades written");
            return EXIT_ERROR;
        } finally {
            if (null != workRoot) {
                if (config.keepAlive) {
                    LOG.info("keeping sandboxes in " + workRoot);
                } else {
                    FileUtils.deleteQuietly(workRoot.toFile());
                }
            }
            batchDone.countDown();
            if (null != shutdownHook) {
                try {
                    Runtime.getRuntime().removeShutdownHook(shutdownHook);
                } catch (IllegalStateException e) {
                    // the JVM is already shutting down and the hook is waiting on batchDone
                }
            }
        }
    }

    /**
     * A shutdown hook for SIGINT/SIGTERM. It interrupts batchThread, which cancels the running sandboxes and releases
     * them on its way out, and waits up to graceMillis for batchDone. If the batch doesn't finish in time, the hook
     * kills every process this JVM started and deletes workRoot itself (unless keepAlive).
     */
    static Thread cancellationHook(final Thread batchThread, final CountDownLatch batchDone, final Path workRoot,
                                   final boolean keepAlive, final long graceMillis) {
        return new Thread(() -> {
            LOG.warning("shutting down, cancelling in-flight sandboxes");
            batchThread.interrupt();
            boolean finished = false;
            try {
                finished = batchDone.await(graceMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (finished) {
                return;
            }
            LOG.warning("batch didn't shut down in time, killing its processes");
            ProcessHandle.current().descendants().forEach(ProcessHandle::destroyForcibly);
            if (!keepAlive) {
                FileUtils.deleteQuietly(workRoot.toFile());
            }
        }, "grade-coordinator-shutdown");
    }

    private static void setupLogging(Path outputDir, boolean verbose) throws IOException {
        final Level level = verbose ? Level.FINE : Level.INFO;
        // every component logs through the root logger
        Logger root = Logger.getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
        }
        root.setLevel(level);

        // log to the console
        ConsoleHandler ch = new ConsoleHandler();
        ch.setLevel(level);
        root.addHandler(ch);
        // log to disk
        final FileHandler fh = new FileHandler(outputDir.resolve(LOG_FILE).toString(), true);
        fh.setLevel(level);
        fh.setFormatter(new SimpleFormatter());
        root.addHandler(fh);
    }

    private static void printHelp() {
        try {
            Parser.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }
}
