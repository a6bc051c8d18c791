package grader.autograder;

import grader.Common;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Grades submissions in sandboxes, running at most {@code concurrencyLimit} sandboxes at once. Jobs start in the order
 * they were submitted, as soon as a worker slot frees up; they may finish in any order.
 *
 * A submission whose sandbox crashes, times out or exits abnormally is recorded as FAILED and the rest of the batch
 * carries on. A {@link SandboxLaunchException} means no sandbox can be provisioned, so it aborts the batch: queued jobs
 * never start, running ones are interrupted, and every sandbox acquired so far is released.
 */
public class SandboxPool {

    private final static Logger LOG = Logger.getLogger("SandboxPool");

    private final SandboxBackend backend;
    private final int concurrencyLimit;
    /** skip sandbox teardown, for post-hoc inspection */
    private final boolean keepAlive;
    /** capture each sandbox's console output */
    private final boolean debug;

    public SandboxPool(SandboxBackend backend, int concurrencyLimit, boolean keepAlive, boolean debug) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrency limit must be positive, got " + concurrencyLimit);
        }
        this.backend = backend;
        this.concurrencyLimit = concurrencyLimit;
        this.keepAlive = keepAlive;
        this.debug = debug;
    }

    public List<SubmissionJob> submit(List<SubmissionJob> jobs) throws SandboxLaunchException, InterruptedException {
        return submit(jobs, null);
    }

    /**
     * Grade every job.
     * @param jobs the jobs to run, all QUEUED
     * @param onCompleted called (from the calling thread) with each job as it reaches COMPLETED or FAILED
     * @return the jobs in the order they finished
     * @throws SandboxLaunchException if the backend can't provision sandboxes; the batch is aborted
     * @throws InterruptedException if the calling thread is interrupted; the batch is aborted
     */
    public List<SubmissionJob> submit(List<SubmissionJob> jobs, @Nullable Consumer<SubmissionJob> onCompleted)
            throws SandboxLaunchException, InterruptedException {
        final List<SubmissionJob> finished = new ArrayList<>(jobs.size());
        if (jobs.isEmpty()) {
            return finished;
        }

        backend.prepare();

        final Deque<SubmissionJob> queue = new ArrayDeque<>(jobs);
        final Deque<Integer> freeSlots = new ArrayDeque<>();
        final int nWorkers = Math.min(concurrencyLimit, jobs.size());
        for (int i = 0; i < nWorkers; i++) {
            freeSlots.add(i);
        }

        final ExecutorService exe = Executors.newFixedThreadPool(nWorkers, workerThreads());
        final CompletionService<SubmissionJob> ecs = new ExecutorCompletionService<>(exe);
        int inFlight = 0;
        LOG.info(String.format("grading %d submissions in up to %d sandboxes", jobs.size(), nWorkers));

        try {
            while (!queue.isEmpty() || inFlight > 0) {
                while (!queue.isEmpty() && !freeSlots.isEmpty()) {
                    final SubmissionJob job = queue.poll();
                    final int slot = freeSlots.poll();
                    ecs.submit(() -> runJob(job, slot));
                    inFlight++;
                }

                // wait for whichever sandbox finishes first
                Future<SubmissionJob> f = ecs.take();
                inFlight--;
                final SubmissionJob done;
                try {
                    done = f.get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof SandboxLaunchException) {
                        LOG.severe(String.format("sandbox launch failed, aborting with %d submissions unfinished: %s",
                                queue.size() + inFlight, e.getCause().getMessage()));
                        throw (SandboxLaunchException) e.getCause();
                    }
                    throw new IllegalStateException("sandbox worker crashed", e.getCause());
                }

                freeSlots.add(done.getSlot());
                finished.add(done);
                LOG.info(String.format("[%d/%d] %s", finished.size(), jobs.size(), done));
                if (null != onCompleted) {
                    onCompleted.accept(done);
                }
            }
        } finally {
            shutdown(exe);
            if (!keepAlive) {
                backend.dispose();
            }
        }
        return finished;
    }

    /** Runs in a worker thread. Only a launch failure escapes. */
    private SubmissionJob runJob(SubmissionJob job, int slot) throws SandboxLaunchException {
        job.markRunning(slot);
        LOG.fine("starting " + job);

        final Sandbox sb;
        try {
            sb = backend.acquire(job, debug);
        } catch (SandboxLaunchException e) {
            job.finish(SubmissionResult.failure("sandbox launch failed: " + e.getMessage(), null));
            throw e;
        } catch (RuntimeException | Error e) {
            job.finish(SubmissionResult.failure("sandbox launch failed: " + e, null));
            throw new SandboxLaunchException("couldn't acquire a sandbox for " + job.key, e);
        }

        SubmissionResult result;
        try {
            sb.run();
            result = sb.collect();
        } catch (SandboxExecutionException e) {
            LOG.warning(String.format("grading %s failed in sandbox %s: %s", job.key, sb.id(), e.getMessage()));
            result = SubmissionResult.failure(e.getMessage(), e.getConsoleOutput());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("cancelled grading of " + job.key);
            result = SubmissionResult.failure("grading cancelled", null);
        } catch (RuntimeException | Error e) {
            LOG.severe(Common.t2s(e, "sandbox " + sb.id() + " crashed while grading " + job.key));
            result = SubmissionResult.failure("sandbox crashed: " + e, null);
        } finally {
            if (keepAlive) {
                LOG.info("keeping sandbox " + sb.id() + " for " + job.key);
            } else {
                release(sb);
            }
        }

        if (debug && null != result.consoleOutput) {
            LOG.info(String.format("console output of %s (%s):%n%s", job.key, sb.id(), result.consoleOutput));
        }
        job.finish(result);
        return job;
    }

    private static void release(Sandbox sb) {
        try {
            sb.release();
        } catch (RuntimeException e) {
            LOG.warning(Common.t2s(e, "couldn't release sandbox " + sb.id()));
        }
    }

    /** interrupt any running sandboxes and wait until they've all been released */
    private static void shutdown(ExecutorService exe) {
        exe.shutdownNow();
        boolean interrupted = false;
        while (true) {
            try {
                if (exe.awaitTermination(30, TimeUnit.SECONDS)) {
                    break;
                }
                LOG.warning("still waiting for sandboxes to shut down...");
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        final AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "sandbox-worker-" + n.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
