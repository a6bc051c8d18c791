package grader.autograder;

import grader.testfiles.PointAllocationException;
import grader.testfiles.TestFile;
import grader.testfiles.TestFileDefaults;
import grader.testfiles.TestFileFormat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * The autograder bundle: a directory (or .zip of one) whose tests/ directory holds the test files. Anything else in
 * the bundle (support files, expected outputs) is copied into every sandbox alongside the tests.
 */
public final class AutograderBundle {

    public static final String TESTS_DIR = "tests";

    private final static Logger LOG = Logger.getLogger("AutograderBundle");

    private AutograderBundle() {}

    /**
     * Extract a bundle .zip into dir
     * @throws IOException if the archive is corrupt or tries to write outside dir
     */
    public static Path unpack(Path zip, Path dir) throws IOException {
        Files.createDirectories(dir);
        final Path root = dir.toAbsolutePath().normalize();
        try (ZipFile f = new ZipFile(zip.toFile())) {
            for (ZipEntry e : Collections.list(f.entries())) {
                Path target = root.resolve(e.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("zip entry " + e.getName() + " escapes " + dir);
                }
                if (e.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = f.getInputStream(e)) {
                    Files.copy(in, target);
                }
            }
        }
        return root;
    }

    /**
     * Parse every test file in bundleDir/tests, in file name order. Files in an unknown format are skipped.
     * @throws IOException if there is no tests directory or a test file is malformed
     * @throws PointAllocationException if a test file's point values are inconsistent
     */
    public static List<TestFile> loadTestFiles(Path bundleDir, TestFileDefaults defaults)
            throws IOException, PointAllocationException {
        Path testsDir = bundleDir.resolve(TESTS_DIR);
        if (!Files.isDirectory(testsDir)) {
            throw new IOException("autograder bundle " + bundleDir + " has no " + TESTS_DIR + "/ directory");
        }

        List<Path> paths = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(testsDir)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    paths.add(p);
                }
            }
        }
        Collections.sort(paths);

        List<TestFile> testFiles = new ArrayList<>();
        for (Path p : paths) {
            Optional<TestFileFormat> fmt = TestFileFormat.forPath(p);
            if (!fmt.isPresent()) {
                LOG.fine("skipping " + p + ", not a test file");
                continue;
            }
            testFiles.add(fmt.get().parse(p, defaults));
        }
        return testFiles;
    }
}
