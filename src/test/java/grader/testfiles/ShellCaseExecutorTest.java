package grader.testfiles;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.Assert.*;

public class ShellCaseExecutorTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ShellCaseExecutor exe = new ShellCaseExecutor();

    private ExecutionContext ctx(Duration timeout) throws IOException {
        Path submission = tmp.newFile("hello.txt").toPath();
        Files.write(submission, Arrays.asList("hello world"));
        return new ExecutionContext(tmp.getRoot().toPath(), submission, timeout);
    }

    @Test
    public void exitZeroPasses() throws Exception {
        CaseOutcome o = exe.execute(TestCase.of("echo", "echo out; echo err 1>&2", null), ctx(Duration.ofSeconds(10)));
        assertTrue(o.passed);
        assertTrue(o.output, o.output.contains("out"));
        assertTrue(o.output, o.output.contains("err"));
    }

    @Test
    public void nonZeroExitFails() throws Exception {
        CaseOutcome o = exe.execute(TestCase.of("fails", "echo nope; exit 3", null), ctx(Duration.ofSeconds(10)));
        assertFalse(o.passed);
        assertTrue(o.output, o.output.startsWith("exited with code 3"));
        assertTrue(o.output, o.output.contains("nope"));
    }

    @Test
    public void runsInWorkingDirWithSubmission() throws Exception {
        CaseOutcome o = exe.execute(TestCase.of("grep", "grep -q world \"$SUBMISSION\" && test -f hello.txt", null),
                ctx(Duration.ofSeconds(10)));
        assertTrue(o.output, o.passed);
    }

    @Test
    public void timeoutFails() throws Exception {
        long start = System.nanoTime();
        CaseOutcome o = exe.execute(TestCase.of("slow", "sleep 30", null), ctx(Duration.ofSeconds(1)));
        assertFalse(o.passed);
        assertTrue(o.output, o.output.startsWith("timed out after 1 seconds"));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).getSeconds() < 20);
    }

    @Test
    public void timeoutKillsEveryProcessOfTheCase() throws Exception {
        File marker = new File(tmp.getRoot(), "late-marker");
        String body = "sh -c 'sleep 3; touch " + marker.getAbsolutePath() + "'; true";
        CaseOutcome o = exe.execute(TestCase.of("tree", body, null), ctx(Duration.ofSeconds(1)));
        assertFalse(o.passed);
        assertTrue(o.output, o.output.startsWith("timed out after 1 seconds"));

        Thread.sleep(4000);
        assertFalse("a timed-out case kept running", marker.exists());
    }

    @Test
    public void interruptKillsEveryProcessOfTheCase() throws Exception {
        final File marker = new File(tmp.getRoot(), "late-marker");
        final ExecutionContext c = ctx(Duration.ofSeconds(30));
        final String body = "sh -c 'sleep 3; touch " + marker.getAbsolutePath() + "'; true";
        final Exception[] thrown = new Exception[1];
        Thread t = new Thread(() -> {
            try {
                exe.execute(TestCase.of("tree", body, null), c);
            } catch (Exception e) {
                thrown[0] = e;
            }
        });
        t.start();
        Thread.sleep(500);
        t.interrupt();
        t.join(10_000);
        assertTrue(thrown[0] instanceof InterruptedException);

        Thread.sleep(4000);
        assertFalse("an interrupted case kept running", marker.exists());
    }

    @Test
    public void multiByteOutputKeepsItsTail() throws Exception {
        // 1100 two-byte characters, then the line a grader needs to see
        String body = "for i in $(seq 1100); do printf '\\303\\251'; done; echo; echo wrong-answer-42; exit 1";
        CaseOutcome o = exe.execute(TestCase.of("utf8", body, null), ctx(Duration.ofSeconds(10)));
        assertFalse(o.passed);
        assertTrue(o.output, o.output.contains("[output truncated]"));
        assertTrue(o.output, o.output.contains("\u00e9"));
        assertTrue(o.output, o.output.contains("wrong-answer-42"));
    }

    @Test
    public void outputTruncated() throws Exception {
        CaseOutcome o = exe.execute(TestCase.of("noisy", "head -c 5000 /dev/zero | tr '\\0' x; exit 1", null),
                ctx(Duration.ofSeconds(10)));
        assertFalse(o.passed);
        assertTrue(o.output.contains("[output truncated]"));
        assertTrue(o.output.length() < 5000);
    }

    @Test
    public void outputKeptInCaseOutputDir() throws Exception {
        exe.execute(TestCase.of("kept", "echo saved", null), ctx(Duration.ofSeconds(10)));
        File[] outputs = new File(tmp.getRoot(), ShellCaseExecutor.OUTPUT_DIR).listFiles();
        assertNotNull(outputs);
        assertEquals(1, outputs.length);
        assertTrue(outputs[0].getName().startsWith("kept-"));
    }

    @Test
    public void gradesThroughFormat() throws Exception {
        TestFile tf = new TestFile("shell", null, TestFileFormat.CSV, Arrays.asList(
                TestCase.of("ok", "true", null), TestCase.of("bad", "false", null)), 2, false);
        GradeComputer.forFormat(TestFileFormat.CSV).run(tf, ctx(Duration.ofSeconds(10)));
        assertEquals(0.5, tf.getGrade(), 1e-9);
        assertEquals(TestFileState.PARTIAL, tf.getState());
    }
}
