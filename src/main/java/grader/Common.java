package grader;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.RandomAccessFile;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Common things needed by the coordinator and the in-sandbox worker
 */
public class Common {

    public static final String VERSION = "1.0.0";

    /** Default configuration, bundled on the classpath */
    public static final String CONFIG_RESOURCE = "grader.properties";

    private final static Logger LOG = Logger.getLogger("Common");

    private static final long DESTROY_WAIT_SECONDS = 10;

    /**
     * Read the bundled grader.properties, then layer the properties in overrides (if non-null) on top.
     * @param overrides an optional properties file supplied by the user
     * @return the merged properties
     */
    public static Properties loadProperties(File overrides) throws IOException {
        Properties prop = new Properties();
        try (final InputStream stream = Common.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (null == stream) {
                LOG.warning(CONFIG_RESOURCE + " not found on the classpath, using built-in defaults");
            } else {
                prop.load(stream);
            }
        }
        if (null != overrides) {
            try (FileReader fr = new FileReader(overrides)) {
                prop.load(fr);
            }
        }
        return prop;
    }

    /**
     * returns the last length bytes of f, decoded as UTF-8, or "" if f does not exist. A multi-byte character cut off
     * at the start of the tail is dropped.
     */
    public static String tailOfFile(int length, File f) throws IOException {
        if (!f.exists()) {
            return "";
        }
        try (RandomAccessFile raf = new RandomAccessFile(f, "r")) {
            final long fileSize = raf.length();
            final int n = (int) Math.min(length, fileSize);
            final long start = fileSize - n;
            final byte[] buf = new byte[n];
            raf.seek(start);
            raf.readFully(buf);

            int off = 0;
            while (start > 0 && off < n && (buf[off] & 0xC0) == 0x80) {
                off++; // UTF-8 continuation byte
            }
            String s = new String(buf, off, n - off, StandardCharsets.UTF_8);
            return start > 0 ? "[output truncated]\n" + s : s;
        }
    }

    /**
     * Forcibly kill p along with every process it started, then wait (briefly) for p to exit. Descendants are
     * collected before p dies, since after that they are reparented and no longer reachable from p.
     */
    public static void destroyProcessTree(Process p) {
        final Deque<ProcessHandle> pending = p.descendants().collect(Collectors.toCollection(ArrayDeque::new));
        p.destroyForcibly();

        final Set<Long> killed = new HashSet<>();
        while (!pending.isEmpty()) {
            ProcessHandle h = pending.poll();
            if (!killed.add(h.pid())) {
                continue;
            }
            // anything h started since the snapshot
            h.children().forEach(pending::add);
            h.destroyForcibly();
        }

        try {
            if (!p.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warning("process " + p.pid() + " still running after being killed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Helper function to convert a Throwable's stack trace to a string */
    public static String t2s(Throwable t, String msg) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        t.printStackTrace(pw);
        pw.println();
        pw.println(t.getLocalizedMessage());
        pw.println(msg);
        return sw.toString();
    }
}
