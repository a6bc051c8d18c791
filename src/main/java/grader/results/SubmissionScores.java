package grader.results;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One submission's score table, as input to {@link ResultAggregator} */
public final class SubmissionScores {
    /** the submission's file name */
    public final String key;
    /** test file name => score, in the order the test files were graded */
    public final Map<String, Double> scores;
    @Nullable
    public final String diagnostic;

    public SubmissionScores(String key, Map<String, Double> scores, @Nullable String diagnostic) {
        this.key = key;
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        this.diagnostic = diagnostic;
    }
}
