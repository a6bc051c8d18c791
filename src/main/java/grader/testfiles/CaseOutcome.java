package grader.testfiles;

/** What a {@link CaseExecutor} reports back for one test case */
public final class CaseOutcome {
    public final boolean passed;
    /** captured output or diagnostic, never null */
    public final String output;

    private CaseOutcome(boolean passed, String output) {
        this.passed = passed;
        this.output = null == output ? "" : output;
    }

    public static CaseOutcome pass(String output) {
        return new CaseOutcome(true, output);
    }

    public static CaseOutcome fail(String output) {
        return new CaseOutcome(false, output);
    }
}
