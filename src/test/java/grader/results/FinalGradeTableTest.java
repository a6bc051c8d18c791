package grader.results;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class FinalGradeTableTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void writeAndReadBack() throws IOException {
        FinalGradeTable t = new FinalGradeTable(FinalGradeTable.FILE_COLUMN, Arrays.asList("q1", "q2, with comma"),
                Arrays.asList(
                        new FinalGradeTable.Row("b.py", Arrays.asList(1.0, 0.5), null),
                        new FinalGradeTable.Row("a.py", Arrays.asList(0.0, 0.0), "timed out")));
        Path out = tmp.getRoot().toPath().resolve("final_grades.csv");
        t.writeCsv(out);

        try (Reader in = Files.newBufferedReader(out, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.withFirstRecordAsHeader().parse(in)) {
            assertEquals(Arrays.asList("file", "q1", "q2, with comma"), parser.getHeaderNames());
            List<CSVRecord> records = parser.getRecords();
            assertEquals(2, records.size());
            assertEquals("b.py", records.get(0).get("file"));
            assertEquals(0.5, Double.parseDouble(records.get(0).get("q2, with comma")), 1e-9);
            assertEquals("a.py", records.get(1).get("file"));
        }
    }

    @Test
    public void rowsAreImmutable() {
        FinalGradeTable t = new FinalGradeTable(FinalGradeTable.FILE_COLUMN, Arrays.asList("q1"),
                Arrays.asList(new FinalGradeTable.Row("a.py", Arrays.asList(1.0), null)));
        try {
            t.getRows().get(0).scores.set(0, 0.0);
            fail("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException expected) {
            assertEquals(1.0, t.get("a.py", "q1"), 0.0);
        }
    }

    @Test(expected = AggregationSchemaException.class)
    public void rowWidthMustMatchHeader() {
        new FinalGradeTable(FinalGradeTable.FILE_COLUMN, Arrays.asList("q1", "q2"),
                Arrays.asList(new FinalGradeTable.Row("a.py", Arrays.asList(1.0), null)));
    }
}
