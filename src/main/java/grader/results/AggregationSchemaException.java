package grader.results;

/**
 * The merged grade table would be inconsistent, e.g., a submission can't be attributed to a student. This signals a
 * broken contract elsewhere in the pipeline, so it is never recovered from.
 */
public class AggregationSchemaException extends RuntimeException {
    public AggregationSchemaException(String message) {
        super(message);
    }

    public AggregationSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
