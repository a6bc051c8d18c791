package grader.autograder;

/**
 * A sandbox couldn't be provisioned at all, e.g., its image is missing. Nothing else in the batch can run either, so
 * this aborts the whole batch.
 */
public class SandboxLaunchException extends Exception {
    public SandboxLaunchException(String message) {
        super(message);
    }

    public SandboxLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
