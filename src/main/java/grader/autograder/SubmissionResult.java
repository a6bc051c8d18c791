package grader.autograder;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What came back from grading one submission. A failed result has an empty score table and a diagnostic explaining
 * what went wrong.
 */
public final class SubmissionResult {
    /** test file name => score, in grading order */
    public final Map<String, Double> scores;
    public final boolean failed;
    @Nullable
    public final String diagnostic;
    /** the sandbox's console output, if it was captured */
    @Nullable
    public final String consoleOutput;
    /** files copied out of the sandbox */
    public final List<Path> artifacts;

    private SubmissionResult(Map<String, Double> scores, boolean failed, @Nullable String diagnostic,
                             @Nullable String consoleOutput, List<Path> artifacts) {
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        this.failed = failed;
        this.diagnostic = diagnostic;
        this.consoleOutput = consoleOutput;
        this.artifacts = Collections.unmodifiableList(new ArrayList<>(artifacts));
    }

    public static SubmissionResult graded(Map<String, Double> scores, @Nullable String consoleOutput,
                                          List<Path> artifacts) {
        return new SubmissionResult(scores, false, null, consoleOutput, artifacts);
    }

    public static SubmissionResult failure(String diagnostic, @Nullable String consoleOutput) {
        return new SubmissionResult(Collections.emptyMap(), true, diagnostic, consoleOutput, Collections.emptyList());
    }

    @Override
    public String toString() {
        return failed ? "failed: " + diagnostic : "graded: " + scores;
    }
}
