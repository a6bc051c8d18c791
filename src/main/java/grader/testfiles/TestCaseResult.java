package grader.testfiles;

/** The outcome of running one TestCase. Created once per case per run. */
public final class TestCaseResult {
    public final TestCase testCase;
    public final boolean passed;
    /** message for the student */
    public final String message;
    public final double points;

    TestCaseResult(TestCase testCase, boolean passed, String message, double points) {
        this.testCase = testCase;
        this.passed = passed;
        this.message = message;
        this.points = points;
    }

    @Override
    public String toString() {
        return String.format("%s: %s (%.2f points)", testCase.name, passed ? "passed" : "failed", points);
    }
}
