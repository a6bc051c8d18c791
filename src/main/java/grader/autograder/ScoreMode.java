package grader.autograder;

/** What goes in the cells of the grade table */
public enum ScoreMode {
    /** fraction of each test file's value earned, in [0,1] */
    FRACTION,
    /** points earned on each test file */
    POINTS
}
