package grader.testfiles;

/**
 * Plain-text summaries of test files that have been run
 */
public final class TestFileSummary {

    private TestFileSummary() {}

    /**
     * e.g. "q1 passed!" or "q1 results:" followed by the message of each failed case. Messages of hidden cases are
     * not shown unless showHidden is set.
     */
    public static String plain(TestFile tf, boolean showHidden) {
        if (tf.isPassedAll()) {
            return tf.name + " passed!";
        }
        StringBuilder sb = new StringBuilder(tf.name).append(" results:");
        for (TestCaseResult r : tf.getTestCaseResults()) {
            if (r.passed) {
                continue;
            }
            sb.append(String.format("%n  %s: ", r.testCase.name));
            if (r.testCase.hidden && !showHidden) {
                sb.append("(hidden) failed");
            } else {
                sb.append(r.message.replace("\n", String.format("%n    ")));
            }
        }
        return sb.toString();
    }
}
