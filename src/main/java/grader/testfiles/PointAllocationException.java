package grader.testfiles;

/**
 * A test file's point budget can't be resolved. Raised before anything runs; fatal for the whole batch.
 */
public class PointAllocationException extends Exception {
    private final String testFile;

    public PointAllocationException(String testFile, String message) {
        super(testFile.isEmpty() ? message : message + ": " + testFile);
        this.testFile = testFile;
    }

    /** name of the offending test file ("" if unknown) */
    public String getTestFile() {
        return testFile;
    }
}
