package ai.tabprof.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a profiling run. Columns keep the order of the source.
 */
public class ProfileReport {

    private final long rows;
    private final long duplicateRowCount;
    private final boolean duplicateCountApprox;
    private final long chunks;
    private final Map<String, ColumnSummary> columns;

    public ProfileReport(long rows,
                         long duplicateRowCount,
                         boolean duplicateCountApprox,
                         long chunks,
                         Map<String, ColumnSummary> columns) {
        this.rows = rows;
        this.duplicateRowCount = duplicateRowCount;
        this.duplicateCountApprox = duplicateCountApprox;
        this.chunks = chunks;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static ProfileReport empty() {
        return new ProfileReport(0, 0, false, 0, Collections.emptyMap());
    }

    public long getRows() {
        return rows;
    }

    public long getDuplicateRowCount() {
        return duplicateRowCount;
    }

    /**
     * @return true when duplicate tracking stopped before the end of the input
     */
    public boolean isDuplicateCountApprox() {
        return duplicateCountApprox;
    }

    public long getChunks() {
        return chunks;
    }

    public Map<String, ColumnSummary> getColumns() {
        return columns;
    }

    public ColumnSummary column(String name) {
        return columns.get(name);
    }
}
