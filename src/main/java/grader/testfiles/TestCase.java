package grader.testfiles;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A single test case within a test file. Instances are immutable; resolving points yields a new TestCase via
 * {@link #withPoints(double)}.
 */
public final class TestCase {
    public final String name;
    /** what gets run for this case; for the shipped formats, a shell command */
    public final String body;
    public final boolean hidden;
    @Nullable
    public final String successMessage;
    @Nullable
    public final String failureMessage;
    /** explicit point value, null until resolved if the test file didn't specify one */
    @Nullable
    public final Double points;

    /**
     * @param name name of this case, unique within its test file
     * @param body the executable body of this case
     * @param hidden whether students get to see this case's output
     * @param success message shown when the case passes (null for the default)
     * @param failure message shown when the case fails (null for the default)
     * @param points explicit point value, or null to receive a share of the test file's remaining budget
     */
    public TestCase(String name, String body, boolean hidden, @Nullable String success, @Nullable String failure,
                    @Nullable Double points) {
        this.name = Objects.requireNonNull(name, "test case name");
        this.body = Objects.requireNonNull(body, "test case body");
        this.hidden = hidden;
        this.successMessage = success;
        this.failureMessage = failure;
        this.points = points;
    }

    /** a visible case with default messages */
    public static TestCase of(String name, String body, @Nullable Double points) {
        return new TestCase(name, body, false, null, null, points);
    }

    public TestCase withPoints(double p) {
        return new TestCase(name, body, hidden, successMessage, failureMessage, p);
    }

    @Override
    public String toString() {
        return String.format("TestCase %s (points: %s%s)", name, points, hidden ? ", hidden" : "");
    }
}
