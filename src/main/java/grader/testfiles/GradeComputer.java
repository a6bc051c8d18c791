package grader.testfiles;

import grader.Common;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs the cases of a TestFile and computes its grade.
 */
public class GradeComputer {

    private final static Logger LOG = Logger.getLogger("GradeComputer");

    static final String DEFAULT_SUCCESS = "passed";
    static final String DEFAULT_FAILURE = "failed";

    private final CaseExecutor executor;

    public GradeComputer(CaseExecutor executor) {
        this.executor = executor;
    }

    /** a GradeComputer that runs cases the way the given format's bodies expect */
    public static GradeComputer forFormat(TestFileFormat format) {
        return new GradeComputer(format.executor());
    }

    /**
     * Run every case of tf, in order, and record the results on tf. A case that throws or times out fails without
     * affecting the other cases. If the current thread is interrupted, the remaining cases are recorded as failed and
     * the interrupt flag is left set.
     * @throws IllegalStateException if tf has already been run
     */
    public void run(TestFile tf, ExecutionContext ctx) {
        tf.start();

        final List<TestCase> cases = tf.getTestCases();
        final List<CaseOutcome> outcomes = new ArrayList<>(cases.size());
        boolean interrupted = false;
        for (TestCase tc : cases) {
            if (interrupted) {
                outcomes.add(CaseOutcome.fail("grading interrupted"));
                continue;
            }
            CaseOutcome o;
            try {
                o = executor.execute(tc, ctx);
                if (null == o) {
                    o = CaseOutcome.fail("test case produced no outcome");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                o = CaseOutcome.fail("grading interrupted");
            } catch (Exception e) {
                LOG.fine(Common.t2s(e, "test case " + tf.name + "/" + tc.name + " crashed"));
                o = CaseOutcome.fail(e.toString());
            }
            outcomes.add(o);
        }

        boolean passedAll = outcomes.stream().allMatch(o -> o.passed);
        List<TestCaseResult> results = new ArrayList<>(cases.size());
        double earned = 0;
        for (int i = 0; i < cases.size(); i++) {
            TestCase tc = cases.get(i);
            CaseOutcome o = outcomes.get(i);
            // NB: under all-or-nothing a passing case only earns its weight if every case passed
            boolean earns = o.passed && (!tf.allOrNothing || passedAll);
            double pts = earns ? tc.points : 0.0;
            earned += pts;
            results.add(new TestCaseResult(tc, o.passed, message(tc, o), pts));
        }

        final double grade;
        if (tf.allOrNothing) {
            grade = passedAll ? 1.0 : 0.0;
        } else {
            grade = Math.max(0.0, Math.min(1.0, earned / tf.totalValue));
        }

        tf.finish(results, grade, passedAll);
        LOG.finer(tf.toString());
    }

    private static String message(TestCase tc, CaseOutcome o) {
        if (o.passed) {
            return null == tc.successMessage ? DEFAULT_SUCCESS : tc.successMessage;
        }
        String msg = null == tc.failureMessage ? DEFAULT_FAILURE : tc.failureMessage;
        return o.output.isEmpty() ? msg : msg + "\n" + o.output;
    }
}
