package grader.testfiles;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single test file: a named, ordered collection of test cases that contributes one score column. Point values are
 * resolved when the TestFile is constructed, so a misconfigured test file is rejected before anything runs. A
 * {@link GradeComputer} fills in the results exactly once; after that the TestFile doesn't change.
 */
public final class TestFile {
    public final String name;
    @Nullable
    public final Path path;
    public final TestFileFormat format;
    /** what this test file is worth in total */
    public final double totalValue;
    /** whether the test file is graded all-or-nothing across cases */
    public final boolean allOrNothing;

    private final List<TestCase> testCases;

    private TestFileState state = TestFileState.NOT_RUN;
    private List<TestCaseResult> testCaseResults = Collections.emptyList();
    private double grade;
    private boolean passedAll;

    /**
     * @param name the name of test file
     * @param path the path to the test file, null if it wasn't read from disk
     * @param format the format the test file was written in
     * @param cases parsed test cases, with some or all points unspecified
     * @param totalValue the point value of the whole test file
     * @param allOrNothing whether the test should be graded all-or-nothing across cases
     * @throws PointAllocationException if the cases' points can't be resolved against totalValue
     */
    public TestFile(String name, @Nullable Path path, TestFileFormat format, List<TestCase> cases, double totalValue,
                    boolean allOrNothing) throws PointAllocationException {
        this.name = Objects.requireNonNull(name);
        this.path = path;
        this.format = Objects.requireNonNull(format);
        this.totalValue = totalValue;
        this.allOrNothing = allOrNothing;
        this.testCases = Collections.unmodifiableList(PointAllocator.resolve(totalValue, cases, name));
    }

    public List<TestCase> getTestCases() {
        return testCases;
    }

    /** @return the resolved weight of each test case, in order */
    public List<Double> getValues() {
        List<Double> values = new ArrayList<>(testCases.size());
        for (TestCase tc : testCases) {
            values.add(tc.points);
        }
        return values;
    }

    public TestFileState getState() {
        return state;
    }

    public List<TestCaseResult> getTestCaseResults() {
        return testCaseResults;
    }

    /** @return the fraction of totalValue earned, in [0,1] */
    public double getGrade() {
        checkRun();
        return grade;
    }

    public boolean isPassedAll() {
        checkRun();
        return passedAll;
    }

    public double getPointsEarned() {
        checkRun();
        return grade * totalValue;
    }

    void start() {
        if (TestFileState.NOT_RUN != state) {
            throw new IllegalStateException("test file " + name + " has already been run (" + state + ")");
        }
        state = TestFileState.RUNNING;
    }

    void finish(List<TestCaseResult> results, double grade, boolean passedAll) {
        assert TestFileState.RUNNING == state : state;
        this.testCaseResults = Collections.unmodifiableList(new ArrayList<>(results));
        this.grade = grade;
        this.passedAll = passedAll;
        if (passedAll) {
            state = TestFileState.PASSED_ALL;
        } else if (0.0 == grade) {
            state = TestFileState.FAILED_ALL;
        } else {
            state = TestFileState.PARTIAL;
        }
    }

    private void checkRun() {
        if (!state.isTerminal()) {
            throw new IllegalStateException("test file " + name + " has not been run");
        }
    }

    @Override
    public String toString() {
        return String.format("TestFile %s [%s, %d cases, %.2f points%s]", name, state, testCases.size(), totalValue,
                allOrNothing ? ", all-or-nothing" : "");
    }
}
