package grader.testfiles;

public enum TestFileState {
    NOT_RUN,
    RUNNING,
    PASSED_ALL,
    PARTIAL,
    FAILED_ALL;

    public boolean isTerminal() {
        return this == PASSED_ALL || this == PARTIAL || this == FAILED_ALL;
    }
}
