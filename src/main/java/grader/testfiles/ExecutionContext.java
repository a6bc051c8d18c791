package grader.testfiles;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Where and how test case bodies run. Immutable. */
public final class ExecutionContext {
    /** Environment variable holding the path of the submission under test */
    public static final String SUBMISSION_ENV = "SUBMISSION";

    public final Path workingDir;
    @Nullable
    public final Path submission;
    public final Duration caseTimeout;
    public final Map<String, String> environment;

    /**
     * @param workingDir directory case bodies run in
     * @param submission the submission being graded, exported to case bodies as $SUBMISSION (null for none)
     * @param caseTimeout how long a single case may run before it fails
     */
    public ExecutionContext(Path workingDir, @Nullable Path submission, Duration caseTimeout) {
        this.workingDir = workingDir;
        this.submission = submission;
        this.caseTimeout = caseTimeout;
        Map<String, String> env = new LinkedHashMap<>();
        if (null != submission) {
            env.put(SUBMISSION_ENV, submission.toAbsolutePath().toString());
        }
        this.environment = Collections.unmodifiableMap(env);
    }
}
