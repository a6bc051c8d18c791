package grader.testfiles;

/**
 * Runs the body of a single test case. Implementations may throw anything; {@link GradeComputer} records an exception
 * as a failed case and moves on to the next one.
 */
@FunctionalInterface
public interface CaseExecutor {
    CaseOutcome execute(TestCase testCase, ExecutionContext ctx) throws Exception;
}
