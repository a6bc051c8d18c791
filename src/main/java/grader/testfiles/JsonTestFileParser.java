package grader.testfiles;

import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.Key;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads JSON test files, e.g.
 * <pre>
 * {"name": "q1", "points": 2, "all_or_nothing": false,
 *  "cases": [{"name": "compiles", "command": "javac Main.java", "points": 1},
 *            {"name": "output", "command": "java Main | diff - expected.txt", "hidden": true}]}
 * </pre>
 */
class JsonTestFileParser {

    public static class JsonTestFile {
        @Key
        public String name;
        @Key
        public Double points;
        @Key("all_or_nothing")
        public Boolean allOrNothing;
        @Key
        public JsonTestCase[] cases;
    }

    public static class JsonTestCase {
        @Key
        public String name;
        @Key
        public String command;
        @Key
        public Boolean hidden;
        @Key
        public Double points;
        @Key("success_message")
        public String successMessage;
        @Key("failure_message")
        public String failureMessage;
    }

    static TestFile parse(Path f, TestFileDefaults defaults) throws IOException, PointAllocationException {
        final JsonTestFile jtf;
        try (Reader r = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
            jtf = GsonFactory.getDefaultInstance().createJsonParser(r).parse(JsonTestFile.class);
        } catch (IllegalArgumentException e) {
            throw new IOException("malformed test file " + f, e);
        }
        if (null == jtf) {
            throw new IOException("empty test file " + f);
        }

        final String name = null == jtf.name || jtf.name.isEmpty() ? TestFileFormat.baseName(f) : jtf.name;
        List<TestCase> cases = new ArrayList<>();
        if (null != jtf.cases) {
            for (int i = 0; i < jtf.cases.length; i++) {
                JsonTestCase jc = jtf.cases[i];
                if (null == jc || null == jc.command) {
                    throw new IOException(String.format("test case %d of %s has no command", i + 1, f));
                }
                String caseName = null == jc.name ? name + " - " + (i + 1) : jc.name;
                cases.add(new TestCase(caseName, jc.command, Boolean.TRUE.equals(jc.hidden),
                        jc.successMessage, jc.failureMessage, jc.points));
            }
        }

        double total = null == jtf.points ? defaults.points : jtf.points;
        boolean aon = null == jtf.allOrNothing ? defaults.allOrNothing : jtf.allOrNothing;
        return new TestFile(name, f, TestFileFormat.JSON, cases, total, aon);
    }
}
