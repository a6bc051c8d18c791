package grader.testfiles;

/** Values a test file gets when its source doesn't say otherwise */
public final class TestFileDefaults {
    public final double points;
    public final boolean allOrNothing;

    public TestFileDefaults(double points, boolean allOrNothing) {
        this.points = points;
        this.allOrNothing = allOrNothing;
    }
}
