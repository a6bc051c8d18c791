package grader.autograder;

import javax.annotation.Nullable;

/**
 * Grading a single submission crashed, timed out or exited abnormally. Only that submission is affected; it gets a
 * zero score and the batch carries on.
 */
public class SandboxExecutionException extends Exception {
    @Nullable
    private final String consoleOutput;

    public SandboxExecutionException(String message, @Nullable String consoleOutput) {
        super(message);
        this.consoleOutput = consoleOutput;
    }

    public SandboxExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.consoleOutput = null;
    }

    /** whatever the sandbox printed before it failed, if available */
    @Nullable
    public String getConsoleOutput() {
        return consoleOutput;
    }
}
