package grader.results;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The merged grades for a batch: one row per submission, in the order the submissions were discovered, and one column
 * per test file. The first column holds the submission's file name, or the student's identifier if an
 * {@link IdentifierResolver} was used.
 */
public final class FinalGradeTable {

    public static final String FILE_COLUMN = "file";
    public static final String IDENTIFIER_COLUMN = "identifier";

    public static final class Row {
        /** file name or identifier, depending on the table's key column */
        public final String key;
        public final List<Double> scores;
        /** why this submission didn't grade normally, null if it did */
        @Nullable
        public final String diagnostic;

        Row(String key, List<Double> scores, @Nullable String diagnostic) {
            this.key = key;
            this.scores = Collections.unmodifiableList(new ArrayList<>(scores));
            this.diagnostic = diagnostic;
        }
    }

    private final String keyColumn;
    private final List<String> scoreColumns;
    private final List<Row> rows;

    /**
     * @throws AggregationSchemaException if a row doesn't have exactly one score per score column
     */
    FinalGradeTable(String keyColumn, List<String> scoreColumns, List<Row> rows) {
        for (Row r : rows) {
            if (r.scores.size() != scoreColumns.size()) {
                throw new AggregationSchemaException(String.format("row %s has %d scores but the table has %d columns",
                        r.key, r.scores.size(), scoreColumns.size()));
            }
        }
        this.keyColumn = keyColumn;
        this.scoreColumns = Collections.unmodifiableList(new ArrayList<>(scoreColumns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public List<String> getScoreColumns() {
        return scoreColumns;
    }

    /** key column followed by the score columns */
    public List<String> getHeader() {
        List<String> h = new ArrayList<>(scoreColumns.size() + 1);
        h.add(keyColumn);
        h.addAll(scoreColumns);
        return h;
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * @return the score of the row with the given key in the given column
     * @throws IllegalArgumentException if there is no such row or column
     */
    public double get(String key, String column) {
        int c = scoreColumns.indexOf(column);
        if (c < 0) {
            throw new IllegalArgumentException("no column " + column);
        }
        for (Row r : rows) {
            if (r.key.equals(key)) {
                return r.scores.get(c);
            }
        }
        throw new IllegalArgumentException("no row " + key);
    }

    public void writeCsv(Writer w) throws IOException {
        CSVPrinter csvPrinter = new CSVPrinter(w, CSVFormat.DEFAULT.withHeader(getHeader().toArray(new String[0])));
        for (Row r : rows) {
            List<Object> record = new ArrayList<>(scoreColumns.size() + 1);
            record.add(r.key);
            record.addAll(r.scores);
            csvPrinter.printRecord(record);
        }
        csvPrinter.flush();
    }

    public void writeCsv(Path f) throws IOException {
        try (Writer w = Files.newBufferedWriter(f, StandardCharsets.UTF_8)) {
            writeCsv(w);
        }
    }
}
