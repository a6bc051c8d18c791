package grader.autograder;

import grader.testfiles.TestFileDefaults;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for a grading run, read from grader.properties (see {@link grader.Common#loadProperties}) and
 * possibly overridden from the command line.
 */
public final class GraderConfig {

    static final String CONTAINERS = "containers";
    static final String SANDBOX_TIMEOUT = "sandbox.timeoutSeconds";
    static final String CASE_TIMEOUT = "cases.timeoutSeconds";
    static final String DEFAULT_POINTS = "tests.defaultPoints";
    static final String ALL_OR_NOTHING = "tests.allOrNothing";
    static final String SCORE_MODE = "scores.mode";
    static final String KEEP_ALIVE = "keepAlive";
    static final String DEBUG = "debug";

    /** how many sandboxes may run at once */
    public final int containers;
    /** how long one submission may take to grade, in total */
    public final Duration sandboxTimeout;
    /** how long one test case may run */
    public final Duration caseTimeout;
    public final TestFileDefaults testDefaults;
    public final ScoreMode scoreMode;
    /** don't tear down sandboxes after grading */
    public final boolean keepAlive;
    /** capture the console output of every sandbox */
    public final boolean debug;

    GraderConfig(int containers, Duration sandboxTimeout, Duration caseTimeout, TestFileDefaults testDefaults,
                 ScoreMode scoreMode, boolean keepAlive, boolean debug) {
        if (containers < 1) {
            throw new IllegalArgumentException(CONTAINERS + " must be positive, got " + containers);
        }
        if (sandboxTimeout.isNegative() || sandboxTimeout.isZero() || caseTimeout.isNegative() || caseTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        this.containers = containers;
        this.sandboxTimeout = sandboxTimeout;
        this.caseTimeout = caseTimeout;
        this.testDefaults = testDefaults;
        this.scoreMode = scoreMode;
        this.keepAlive = keepAlive;
        this.debug = debug;
    }

    /**
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public static GraderConfig fromProperties(Properties p) {
        try {
            return new GraderConfig(
                    Integer.parseInt(p.getProperty(CONTAINERS, "4").trim()),
                    Duration.ofSeconds(Long.parseLong(p.getProperty(SANDBOX_TIMEOUT, "600").trim())),
                    Duration.ofSeconds(Long.parseLong(p.getProperty(CASE_TIMEOUT, "60").trim())),
                    new TestFileDefaults(Double.parseDouble(p.getProperty(DEFAULT_POINTS, "1").trim()),
                            Boolean.parseBoolean(p.getProperty(ALL_OR_NOTHING, "true").trim())),
                    ScoreMode.valueOf(p.getProperty(SCORE_MODE, "fraction").trim().toUpperCase(Locale.ROOT)),
                    Boolean.parseBoolean(p.getProperty(KEEP_ALIVE, "false").trim()),
                    Boolean.parseBoolean(p.getProperty(DEBUG, "false").trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number in grader configuration: " + e.getMessage(), e);
        }
    }

    public GraderConfig withContainers(int n) {
        return new GraderConfig(n, sandboxTimeout, caseTimeout, testDefaults, scoreMode, keepAlive, debug);
    }

    public GraderConfig withScoreMode(ScoreMode m) {
        return new GraderConfig(containers, sandboxTimeout, caseTimeout, testDefaults, m, keepAlive, debug);
    }

    public GraderConfig withKeepAlive(boolean k) {
        return new GraderConfig(containers, sandboxTimeout, caseTimeout, testDefaults, scoreMode, k, debug);
    }

    public GraderConfig withDebug(boolean d) {
        return new GraderConfig(containers, sandboxTimeout, caseTimeout, testDefaults, scoreMode, keepAlive, d);
    }

    @Override
    public String toString() {
        return String.format("containers=%d sandboxTimeout=%ds caseTimeout=%ds defaultPoints=%s allOrNothing=%b " +
                        "scores=%s keepAlive=%b debug=%b", containers, sandboxTimeout.getSeconds(),
                caseTimeout.getSeconds(), testDefaults.points, testDefaults.allOrNothing, scoreMode, keepAlive, debug);
    }
}
