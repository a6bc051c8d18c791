package grader.testfiles;

/** Explicit test case points add up to more than the test file is worth. */
public class OverallocatedException extends PointAllocationException {
    public OverallocatedException(String testFile, double specified, double total) {
        super(testFile, String.format("Individual test case point values (%s) exceed total question value (%s)",
                specified, total));
    }
}
