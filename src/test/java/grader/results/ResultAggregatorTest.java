package grader.results;

import org.junit.Test;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ResultAggregatorTest {

    private static final double DELTA = 1e-9;

    /** scores("q1", 1.0, "q2", 0.5) */
    private static Map<String, Double> scores(Object... kvs) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < kvs.length; i += 2) {
            m.put((String) kvs[i], (Double) kvs[i + 1]);
        }
        return m;
    }

    @Test
    public void unionOfColumnsWithZeroFill() {
        List<SubmissionScores> in = Arrays.asList(
                new SubmissionScores("s1.py", scores("A", 1.0, "B", 0.5), null),
                new SubmissionScores("s2.py", scores("A", 0.25, "C", 1.0), null));
        FinalGradeTable t = new ResultAggregator(null).merge(in);

        assertEquals(Arrays.asList("A", "B", "C"), t.getScoreColumns());
        assertEquals(Arrays.asList("file", "A", "B", "C"), t.getHeader());
        assertEquals(FinalGradeTable.FILE_COLUMN, t.getKeyColumn());
        assertEquals(2, t.getRows().size());
        assertEquals(0.0, t.get("s1.py", "C"), DELTA);
        assertEquals(0.0, t.get("s2.py", "B"), DELTA);
        assertEquals(0.25, t.get("s2.py", "A"), DELTA);
        for (FinalGradeTable.Row r : t.getRows()) {
            assertEquals(3, r.scores.size());
        }
    }

    @Test
    public void rowsInInputOrder() {
        List<SubmissionScores> in = Arrays.asList(
                new SubmissionScores("zed.py", scores("A", 1.0), null),
                new SubmissionScores("amy.py", scores("A", 0.0), null),
                new SubmissionScores("kim.py", scores("A", 0.5), null));
        FinalGradeTable t = new ResultAggregator(null).merge(in);
        assertEquals("zed.py", t.getRows().get(0).key);
        assertEquals("amy.py", t.getRows().get(1).key);
        assertEquals("kim.py", t.getRows().get(2).key);
    }

    @Test
    public void repeatedKeyMerges() {
        List<SubmissionScores> in = Arrays.asList(
                new SubmissionScores("s1.py", scores("A", 1.0), "first"),
                new SubmissionScores("s2.py", scores("A", 0.5), null),
                new SubmissionScores("s1.py", scores("B", 0.75), "second"));
        FinalGradeTable t = new ResultAggregator(null).merge(in);
        assertEquals(2, t.getRows().size());
        assertEquals(1.0, t.get("s1.py", "A"), DELTA);
        assertEquals(0.75, t.get("s1.py", "B"), DELTA);
        assertEquals("first\nsecond", t.getRows().get(0).diagnostic);
        assertNull(t.getRows().get(1).diagnostic);
    }

    @Test
    public void nanBecomesZero() {
        FinalGradeTable t = new ResultAggregator(null).merge(Collections.singletonList(
                new SubmissionScores("s1.py", scores("A", Double.NaN), null)));
        assertEquals(0.0, t.get("s1.py", "A"), DELTA);
    }

    @Test
    public void resolverKeysRowsByIdentifier() {
        Map<String, String> ids = new HashMap<>();
        ids.put("s1.py", "alice");
        ids.put("s2.py", "bob");
        FinalGradeTable t = new ResultAggregator(new CsvIdentifierResolver(ids)).merge(Arrays.asList(
                new SubmissionScores("s1.py", scores("A", 1.0), null),
                new SubmissionScores("s2.py", scores("A", 0.0), null)));

        assertEquals(FinalGradeTable.IDENTIFIER_COLUMN, t.getKeyColumn());
        assertEquals(Arrays.asList("identifier", "A"), t.getHeader());
        assertFalse(t.getHeader().contains(FinalGradeTable.FILE_COLUMN));
        assertEquals("alice", t.getRows().get(0).key);
        assertEquals(1.0, t.get("alice", "A"), DELTA);
    }

    @Test(expected = AggregationSchemaException.class)
    public void resolverFailure() {
        new ResultAggregator(new CsvIdentifierResolver(Collections.<String, String>emptyMap())).merge(
                Collections.singletonList(new SubmissionScores("s1.py", scores("A", 1.0), null)));
    }

    @Test(expected = AggregationSchemaException.class)
    public void emptyIdentifier() {
        new ResultAggregator(f -> "").merge(
                Collections.singletonList(new SubmissionScores("s1.py", scores("A", 1.0), null)));
    }

    @Test(expected = AggregationSchemaException.class)
    public void duplicateIdentifier() {
        new ResultAggregator(f -> "same").merge(Arrays.asList(
                new SubmissionScores("s1.py", scores("A", 1.0), null),
                new SubmissionScores("s2.py", scores("A", 1.0), null)));
    }

    @Test(expected = AggregationSchemaException.class)
    public void columnCollidesWithKeyColumn() {
        new ResultAggregator(null).merge(Collections.singletonList(
                new SubmissionScores("s1.py", scores("file", 1.0), null)));
    }

    @Test
    public void emptyInput() {
        FinalGradeTable t = new ResultAggregator(null).merge(Collections.<SubmissionScores>emptyList());
        assertTrue(t.getRows().isEmpty());
        assertEquals(Collections.singletonList("file"), t.getHeader());
    }

    @Test
    public void csvOutput() throws Exception {
        FinalGradeTable t = new ResultAggregator(f -> f.replace(".py", "")).merge(Arrays.asList(
                new SubmissionScores("s1.py", scores("q1", 1.0, "q2", 0.5), null),
                new SubmissionScores("s2.py", scores("q2", 0.0), "crashed")));
        StringWriter w = new StringWriter();
        t.writeCsv(w);
        String[] lines = w.toString().split("\r\n");
        assertEquals(3, lines.length);
        assertEquals("identifier,q1,q2", lines[0]);
        assertEquals("s1,1.0,0.5", lines[1]);
        assertEquals("s2,0.0,0.0", lines[2]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void getMissingRow() {
        new ResultAggregator(null).merge(Collections.singletonList(
                new SubmissionScores("s1.py", scores("A", 1.0), null))).get("nobody", "A");
    }
}
