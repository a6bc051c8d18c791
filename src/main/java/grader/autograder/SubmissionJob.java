package grader.autograder;

import javax.annotation.Nullable;
import java.nio.file.Path;

/**
 * One submission working its way through the {@link SandboxPool}: QUEUED, then RUNNING in some worker slot, then
 * COMPLETED or FAILED with a {@link SubmissionResult} attached.
 */
public final class SubmissionJob {
    /** the submission's file name, which keys its row in the grade table */
    public final String key;
    public final Path path;
    /** position in discovery order */
    public final int index;

    private JobState state = JobState.QUEUED;
    private int slot = -1;
    private SubmissionResult result;

    public SubmissionJob(Path path, int index) {
        this(path.getFileName().toString(), path, index);
    }

    public SubmissionJob(String key, Path path, int index) {
        this.key = key;
        this.path = path;
        this.index = index;
    }

    public synchronized JobState getState() {
        return state;
    }

    /** @return the worker slot this job ran in, or -1 if it never started */
    public synchronized int getSlot() {
        return slot;
    }

    @Nullable
    public synchronized SubmissionResult getResult() {
        return result;
    }

    synchronized void markRunning(int workerSlot) {
        if (JobState.QUEUED != state) {
            throw new IllegalStateException(key + " can't start from state " + state);
        }
        state = JobState.RUNNING;
        slot = workerSlot;
    }

    synchronized void finish(SubmissionResult r) {
        if (JobState.RUNNING != state) {
            throw new IllegalStateException(key + " can't finish from state " + state);
        }
        result = r;
        state = r.failed ? JobState.FAILED : JobState.COMPLETED;
    }

    @Override
    public synchronized String toString() {
        return String.format("%s [%s%s]", key, state, slot >= 0 ? ", slot " + slot : "");
    }
}
