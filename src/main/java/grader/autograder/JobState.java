package grader.autograder;

public enum JobState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
