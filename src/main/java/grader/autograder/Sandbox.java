package grader.autograder;

/**
 * A private, isolated environment for grading exactly one submission. Obtained from
 * {@link SandboxBackend#acquire(SubmissionJob, boolean)}; the {@link SandboxPool} calls {@link #run()}, then
 * {@link #collect()}, and finally {@link #release()} on every exit path (unless sandboxes are being kept alive).
 */
public interface Sandbox {

    /** a name for log messages, e.g., a container id or directory */
    String id();

    /**
     * Grade the submission
     * @throws SandboxExecutionException if grading crashed, timed out or exited abnormally
     * @throws InterruptedException if the batch is being cancelled
     */
    void run() throws SandboxExecutionException, InterruptedException;

    /** @return the scores (and console output/artifacts, if any) produced by {@link #run()} */
    SubmissionResult collect() throws SandboxExecutionException;

    /** tear down this sandbox and free its resources. Must be safe to call after a failed or interrupted run. */
    void release();
}
