package grader.autograder;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.Assert.*;

public class GradeCoordinatorTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static final String OVERALLOCATED =
            "{\"points\": 10, \"cases\": [{\"command\": \"true\", \"points\": 6}, {\"command\": \"true\", \"points\": 6}]}";

    private Path submissions;
    private Path output;

    @Before
    public void setup() throws IOException {
        submissions = tmp.newFolder("submissions").toPath();
        FileUtils.writeStringToFile(submissions.resolve("a.py").toFile(), "pass", StandardCharsets.UTF_8);
        output = tmp.getRoot().toPath().resolve("out");
    }

    @Test
    public void usage() {
        assertEquals(GradeCoordinator.EXIT_USAGE, GradeCoordinator.run(new String[]{}));
        assertEquals(GradeCoordinator.EXIT_USAGE, GradeCoordinator.run(new String[]{"--bogus"}));
        assertEquals(GradeCoordinator.EXIT_OK, GradeCoordinator.run(new String[]{"--help"}));
    }

    @Test
    public void invalidContainers() throws IOException {
        Path bundle = tmp.newFolder("bundle").toPath();
        int rc = GradeCoordinator.run(new String[]{"--path", submissions.toString(), "--autograder", bundle.toString(),
                "--output-dir", output.toString(), "--containers", "0"});
        assertEquals(GradeCoordinator.EXIT_USAGE, rc);
    }

    @Test
    public void overallocatedBundleWritesNothing() throws IOException {
        Path bundle = tmp.newFolder("bundle").toPath();
        Files.createDirectories(bundle.resolve("tests"));
        FileUtils.writeStringToFile(bundle.resolve("tests/q1.json").toFile(), OVERALLOCATED, StandardCharsets.UTF_8);

        int rc = GradeCoordinator.run(new String[]{"--path", submissions.toString(), "--autograder", bundle.toString(),
                "--output-dir", output.toString()});
        assertEquals(GradeCoordinator.EXIT_ALLOCATION, rc);
        assertFalse(Files.exists(output.resolve(GradeCoordinator.OUTPUT_FILE)));
        assertTrue(Files.isRegularFile(output.resolve(GradeCoordinator.LOG_FILE)));
    }

    @Test
    public void zippedBundleIsUnpacked() throws IOException {
        Path zip = tmp.getRoot().toPath().resolve("autograder.zip");
        try (ZipOutputStream zos = new ZipOutputStream(new FileOutputStream(zip.toFile()))) {
            zos.putNextEntry(new ZipEntry("tests/"));
            zos.closeEntry();
            zos.putNextEntry(new ZipEntry("tests/q1.json"));
            zos.write(OVERALLOCATED.getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        int rc = GradeCoordinator.run(new String[]{"--path", submissions.toString(), "--autograder", zip.toString(),
                "--output-dir", output.toString()});
        // the bundle was read, which is how we know its points are bad
        assertEquals(GradeCoordinator.EXIT_ALLOCATION, rc);
    }

    @Test
    public void missingBundle() {
        int rc = GradeCoordinator.run(new String[]{"--path", submissions.toString(),
                "--autograder", tmp.getRoot().toPath().resolve("nope").toString(), "--output-dir", output.toString()});
        assertEquals(GradeCoordinator.EXIT_ERROR, rc);
        assertFalse(Files.exists(output.resolve(GradeCoordinator.OUTPUT_FILE)));
    }

    @Test
    public void shutdownCancelsRunningBatch() throws Exception {
        final FakeBackend be = new FakeBackend();
        final SubmissionJob job = new SubmissionJob(submissions.resolve("slow.py"), 0);
        final CountDownLatch done = new CountDownLatch(1);
        Thread batch = new Thread(() -> {
            try {
                new SandboxPool(be, 1, false, false).submit(Collections.singletonList(job));
            } catch (SandboxLaunchException | InterruptedException e) {
                // cancelled
            } finally {
                done.countDown();
            }
        });
        batch.start();
        while (0 == be.running.get()) {
            Thread.sleep(10);
        }

        Path workRoot = tmp.newFolder("work").toPath();
        long start = System.nanoTime();
        GradeCoordinator.cancellationHook(batch, done, workRoot, false, 10_000).run();

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 10_000);
        assertEquals(JobState.FAILED, job.getState());
        assertTrue(be.released.contains("slow.py"));
        assertTrue(be.disposed);
        // the batch cleaned up after itself, so the hook leaves the work dir to it
        assertTrue(Files.isDirectory(workRoot));
    }

    @Test
    public void shutdownKillsStuckBatch() throws Exception {
        final AtomicBoolean stop = new AtomicBoolean(false);
        Thread stuck = new Thread(() -> {
            while (!stop.get()) {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    // a batch that doesn't respond to cancellation
                }
            }
        });
        stuck.start();
        Process child = new ProcessBuilder("sleep", "60").start();
        Path workRoot = tmp.newFolder("work").toPath();
        FileUtils.writeStringToFile(workRoot.resolve("sandbox-0/x").toFile(), "x", StandardCharsets.UTF_8);

        try {
            GradeCoordinator.cancellationHook(stuck, new CountDownLatch(1), workRoot, false, 200).run();
            assertTrue(child.waitFor(10, TimeUnit.SECONDS));
            assertFalse(Files.exists(workRoot));
        } finally {
            stop.set(true);
            stuck.join();
            child.destroyForcibly();
        }
    }

    @Test
    public void shutdownKeepsWorkDirWithNoKill() throws Exception {
        Path workRoot = tmp.newFolder("work").toPath();
        Thread idle = new Thread(() -> { });
        GradeCoordinator.cancellationHook(idle, new CountDownLatch(1), workRoot, true, 50).run();
        assertTrue(Files.isDirectory(workRoot));
    }
}
