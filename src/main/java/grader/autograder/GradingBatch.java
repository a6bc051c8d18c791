package grader.autograder;

import grader.results.FinalGradeTable;
import grader.results.IdentifierResolver;
import grader.results.ResultAggregator;
import grader.results.SubmissionScores;
import grader.testfiles.PointAllocationException;
import grader.testfiles.TestFile;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Grades a directory of submissions: checks the autograder bundle's point values, runs every submission through a
 * {@link SandboxPool}, and merges the results into a {@link FinalGradeTable} whose rows are in discovery order.
 */
public class GradingBatch {

    private final static Logger LOG = Logger.getLogger("GradingBatch");

    private final GraderConfig config;
    private final SandboxBackend backend;
    private final Path bundleDir;
    @Nullable
    private final IdentifierResolver resolver;

    public GradingBatch(GraderConfig config, SandboxBackend backend, Path bundleDir,
                        @Nullable IdentifierResolver resolver) {
        this.config = config;
        this.backend = backend;
        this.bundleDir = bundleDir;
        this.resolver = resolver;
    }

    /**
     * @param submissionsDir directory holding one file per submission
     * @throws PointAllocationException if a test file's point values are inconsistent. Nothing has been launched.
     * @throws SandboxLaunchException if sandboxes couldn't be provisioned; the batch was aborted
     * @throws grader.results.AggregationSchemaException if the results can't be merged into one table
     */
    public FinalGradeTable run(Path submissionsDir)
            throws IOException, PointAllocationException, SandboxLaunchException, InterruptedException {
        // fail before launching anything if the bundle is misconfigured
        final List<TestFile> testFiles = AutograderBundle.loadTestFiles(bundleDir, config.testDefaults);
        if (testFiles.isEmpty()) {
            LOG.warning("autograder bundle " + bundleDir + " has no test files");
        }
        final List<String> testFileNames = new ArrayList<>(testFiles.size());
        for (TestFile tf : testFiles) {
            testFileNames.add(tf.name);
        }

        final List<SubmissionJob> jobs = discover(submissionsDir);
        LOG.info(String.format("found %d submissions in %s, %d test files", jobs.size(), submissionsDir,
                testFiles.size()));

        SandboxPool pool = new SandboxPool(backend, config.containers, config.keepAlive, config.debug);
        pool.submit(jobs);

        List<SubmissionScores> scores = new ArrayList<>(jobs.size());
        int failures = 0;
        for (SubmissionJob job : jobs) {
            SubmissionResult r = job.getResult();
            if (null == r) {
                throw new IllegalStateException(job + " has no result");
            }
            if (r.failed) {
                failures++;
                scores.add(new SubmissionScores(job.key, zeroes(testFileNames), r.diagnostic));
            } else {
                scores.add(new SubmissionScores(job.key, r.scores, r.diagnostic));
            }
        }
        if (failures > 0) {
            LOG.warning(String.format("%d of %d submissions could not be graded", failures, jobs.size()));
        }

        return new ResultAggregator(resolver).merge(scores);
    }

    /** @return a job for each regular, non-hidden file in dir, ordered by file name */
    static List<SubmissionJob> discover(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("submissions directory " + dir + " does not exist");
        }
        List<Path> paths = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p) && !p.getFileName().toString().startsWith(".")) {
                    paths.add(p);
                }
            }
        }
        Collections.sort(paths);

        List<SubmissionJob> jobs = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            jobs.add(new SubmissionJob(paths.get(i), i));
        }
        return jobs;
    }

    private static Map<String, Double> zeroes(List<String> columns) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (String c : columns) {
            m.put(c, 0.0);
        }
        return m;
    }
}
