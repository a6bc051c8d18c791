package grader.results;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Merges per-submission score tables into a single {@link FinalGradeTable}.
 */
public class ResultAggregator {

    private final static Logger LOG = Logger.getLogger("ResultAggregator");

    @Nullable
    private final IdentifierResolver resolver;

    /** @param resolver maps file names to identifiers, or null to key rows by file name */
    public ResultAggregator(@Nullable IdentifierResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Columns are the union of all test file names, in order of first appearance. Rows follow the order in which
     * submissions first appear in results. A submission that has no score for some column gets a 0 there.
     * @throws AggregationSchemaException if a submission can't be resolved to an identifier, or the merged table
     * would be malformed
     */
    public FinalGradeTable merge(List<SubmissionScores> results) {
        final Set<String> columns = new LinkedHashSet<>();
        final Map<String, Map<String, Double>> scoresOfKey = new LinkedHashMap<>();
        final Map<String, String> diagnosticOfKey = new LinkedHashMap<>();

        for (SubmissionScores s : results) {
            columns.addAll(s.scores.keySet());
            scoresOfKey.computeIfAbsent(s.key, k -> new LinkedHashMap<>()).putAll(s.scores);
            if (null != s.diagnostic) {
                diagnosticOfKey.merge(s.key, s.diagnostic, (a, b) -> a + "\n" + b);
            }
        }

        for (String reserved : new String[]{FinalGradeTable.FILE_COLUMN, FinalGradeTable.IDENTIFIER_COLUMN}) {
            if (columns.contains(reserved)) {
                throw new AggregationSchemaException("test file name '" + reserved + "' collides with a key column");
            }
        }

        final List<String> header = new ArrayList<>(columns);
        final List<FinalGradeTable.Row> rows = new ArrayList<>(scoresOfKey.size());
        final Set<String> rowKeys = new LinkedHashSet<>();
        for (Map.Entry<String, Map<String, Double>> e : scoresOfKey.entrySet()) {
            final String rowKey = rowKey(e.getKey());
            if (!rowKeys.add(rowKey)) {
                throw new AggregationSchemaException("two submissions resolve to identifier " + rowKey);
            }
            List<Double> values = new ArrayList<>(header.size());
            for (String col : header) {
                Double v = e.getValue().get(col);
                values.add(null == v || v.isNaN() ? 0.0 : v);
            }
            rows.add(new FinalGradeTable.Row(rowKey, values, diagnosticOfKey.get(e.getKey())));
        }

        LOG.fine(String.format("merged %d submissions into %d rows x %d columns",
                results.size(), rows.size(), header.size()));
        String keyColumn = null == resolver ? FinalGradeTable.FILE_COLUMN : FinalGradeTable.IDENTIFIER_COLUMN;
        return new FinalGradeTable(keyColumn, header, rows);
    }

    private String rowKey(String filename) {
        if (null == resolver) {
            return filename;
        }
        final String id;
        try {
            id = resolver.fileToId(filename);
        } catch (RuntimeException e) {
            throw new AggregationSchemaException("can't resolve an identifier for " + filename, e);
        }
        if (null == id || id.isEmpty()) {
            throw new AggregationSchemaException("empty identifier for " + filename);
        }
        return id;
    }
}
