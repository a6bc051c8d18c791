package grader.results;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves identifiers from a CSV file with the columns {@code file} and {@code identifier}.
 */
public class CsvIdentifierResolver implements IdentifierResolver {

    static final String FILE_COLUMN = "file";
    static final String IDENTIFIER_COLUMN = "identifier";

    private final Map<String, String> idOfFile;

    CsvIdentifierResolver(Map<String, String> idOfFile) {
        this.idOfFile = Collections.unmodifiableMap(new HashMap<>(idOfFile));
    }

    public static CsvIdentifierResolver load(Path csv) throws IOException {
        Map<String, String> ids = new HashMap<>();
        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            Iterable<CSVRecord> records = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim().parse(in);
            for (CSVRecord record : records) {
                if (!record.isSet(FILE_COLUMN) || !record.isSet(IDENTIFIER_COLUMN)) {
                    throw new IOException(String.format("%s line %d: expected columns '%s' and '%s'",
                            csv, record.getRecordNumber() + 1, FILE_COLUMN, IDENTIFIER_COLUMN));
                }
                String prev = ids.put(record.get(FILE_COLUMN), record.get(IDENTIFIER_COLUMN));
                if (null != prev) {
                    throw new IOException(String.format("%s lists file %s twice", csv, record.get(FILE_COLUMN)));
                }
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("malformed identifier file " + csv, e);
        }
        return new CsvIdentifierResolver(ids);
    }

    @Override
    public String fileToId(String filename) {
        String id = idOfFile.get(filename);
        if (null == id) {
            throw new IllegalArgumentException("no identifier for submission " + filename);
        }
        return id;
    }

    public int size() {
        return idOfFile.size();
    }
}
