package grader.autograder;

/**
 * Provides sandboxes. Implementations must be safe to call {@link #acquire} from several threads at once.
 */
public interface SandboxBackend {

    /**
     * Build whatever the sandboxes are created from (an image). Called once, before any sandbox is acquired.
     * @throws SandboxLaunchException if the image can't be built
     */
    void prepare() throws SandboxLaunchException;

    /**
     * @param job the job the sandbox is for; each job gets its own sandbox
     * @param debug whether to capture the sandbox's console output
     * @throws SandboxLaunchException if the sandbox can't be provisioned
     */
    Sandbox acquire(SubmissionJob job, boolean debug) throws SandboxLaunchException;

    /** release whatever {@link #prepare()} built. Not called when sandboxes are kept alive. */
    default void dispose() {}
}
