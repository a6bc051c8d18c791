package grader.results;

/**
 * Maps a submission's file name to the identifier of the student who submitted it. Implementations must be pure, and
 * should throw (rather than guess) for a file they don't know about.
 */
@FunctionalInterface
public interface IdentifierResolver {
    String fileToId(String filename);
}
