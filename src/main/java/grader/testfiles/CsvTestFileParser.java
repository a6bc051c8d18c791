package grader.testfiles;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads CSV test files: one test case per row, with the header
 * {@code name,command,points,hidden,success_message,failure_message}. Only name and command are required. The test
 * file's total value and all-or-nothing policy come from the defaults.
 */
class CsvTestFileParser {

    static TestFile parse(Path f, TestFileDefaults defaults) throws IOException, PointAllocationException {
        final String name = TestFileFormat.baseName(f);
        List<TestCase> cases = new ArrayList<>();

        try (Reader in = Files.newBufferedReader(f, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim().parse(in)) {
            if (!parser.getHeaderMap().containsKey("name") || !parser.getHeaderMap().containsKey("command")) {
                throw new IOException(f + " needs 'name' and 'command' columns, found " + parser.getHeaderNames());
            }
            for (CSVRecord record : parser) {
                final Double points;
                String pts = get(record, "points");
                try {
                    points = null == pts ? null : Double.parseDouble(pts);
                } catch (NumberFormatException e) {
                    throw new IOException(String.format("bad points value '%s' on line %d of %s",
                            pts, record.getRecordNumber() + 1, f), e);
                }
                cases.add(new TestCase(record.get("name"), record.get("command"),
                        Boolean.parseBoolean(get(record, "hidden")),
                        get(record, "success_message"), get(record, "failure_message"), points));
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            // commons-csv reports duplicate headers and inconsistent records this way
            throw new IOException("malformed test file " + f, e);
        }

        return new TestFile(name, f, TestFileFormat.CSV, cases, defaults.points, defaults.allOrNothing);
    }

    /** @return the trimmed value of column, or null if the column is missing or blank */
    @Nullable
    private static String get(CSVRecord record, String column) {
        if (!record.isSet(column)) {
            return null;
        }
        String v = record.get(column);
        return v.isEmpty() ? null : v;
    }
}
