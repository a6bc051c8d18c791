package grader.testfiles;

import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The test file formats we can read. Each format knows how to parse a test file from disk and how to execute the
 * bodies of its test cases.
 */
public enum TestFileFormat {
    JSON("json"),
    CSV("csv");

    public final String extension;

    private static final CaseExecutor SHELL = new ShellCaseExecutor();

    TestFileFormat(String ext) {
        this.extension = ext;
    }

    /** @return the format for f based on its extension, or empty if f isn't a test file */
    public static Optional<TestFileFormat> forPath(Path f) {
        String ext = FilenameUtils.getExtension(f.getFileName().toString());
        for (TestFileFormat fmt : values()) {
            if (fmt.extension.equalsIgnoreCase(ext)) {
                return Optional.of(fmt);
            }
        }
        return Optional.empty();
    }

    /**
     * Parse the test file at f and resolve its point values
     * @throws IOException if f can't be read or is malformed
     * @throws PointAllocationException if the test file's point values are inconsistent
     */
    public TestFile parse(Path f, TestFileDefaults defaults) throws IOException, PointAllocationException {
        switch (this) {
            case JSON:
                return JsonTestFileParser.parse(f, defaults);
            case CSV:
                return CsvTestFileParser.parse(f, defaults);
            default:
                throw new AssertionError(this);
        }
    }

    /** @return the executor for this format's case bodies */
    public CaseExecutor executor() {
        switch (this) {
            case JSON:
            case CSV:
                return SHELL;
            default:
                throw new AssertionError(this);
        }
    }

    /** base name of f, used as the test file name when the source doesn't give one */
    static String baseName(Path f) {
        return FilenameUtils.getBaseName(f.getFileName().toString());
    }
}
