package grader.autograder;

import com.google.api.client.util.Key;
import grader.testfiles.TestCaseResult;
import grader.testfiles.TestFile;

/**
 * What {@link GradeWorker} reports back from inside a sandbox, as JSON. If grading couldn't even start, error is set
 * and testFiles is null.
 */
public class WorkerReport {
    @Key
    public String submission;
    @Key
    public TestFileReport[] testFiles;
    @Key
    public String error;

    public static class TestFileReport {
        @Key
        public String name;
        @Key
        public Double grade;
        @Key
        public Double pointsEarned;
        @Key
        public Double pointsPossible;
        @Key
        public Boolean passedAll;
        @Key
        public CaseReport[] cases;

        /** empty ctor needed for GSON framework */
        public TestFileReport() {}

        TestFileReport(TestFile tf) {
            name = tf.name;
            grade = tf.getGrade();
            pointsEarned = tf.getPointsEarned();
            pointsPossible = tf.totalValue;
            passedAll = tf.isPassedAll();
            cases = new CaseReport[tf.getTestCaseResults().size()];
            for (int i = 0; i < cases.length; i++) {
                cases[i] = new CaseReport(tf.getTestCaseResults().get(i));
            }
        }
    }

    public static class CaseReport {
        @Key
        public String name;
        @Key
        public Boolean passed;
        @Key
        public Double points;
        @Key
        public Boolean hidden;
        /** withheld for hidden cases */
        @Key
        public String message;

        /** empty ctor needed for GSON framework */
        public CaseReport() {}

        CaseReport(TestCaseResult r) {
            name = r.testCase.name;
            passed = r.passed;
            points = r.points;
            hidden = r.testCase.hidden;
            message = r.testCase.hidden ? null : r.message;
        }
    }

    /** empty ctor needed for GSON framework */
    public WorkerReport() {}

    WorkerReport(String submission, TestFileReport[] testFiles, String error) {
        this.submission = submission;
        this.testFiles = testFiles;
        this.error = error;
    }
}
