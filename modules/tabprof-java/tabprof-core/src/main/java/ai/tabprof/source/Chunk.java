package ai.tabprof.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Batch of rows sharing one column list. A row is an array aligned with the columns, null meaning absent.
 * Rows shorter than the column list are treated as null-padded.
 */
public class Chunk {

    private final List<String> columns;
    private final List<String[]> rows;

    public Chunk(List<String> columns, List<String[]> rows) {
        Set<String> unique = new HashSet<>(columns);
        if (unique.size() != columns.size()) {
            throw new IllegalArgumentException(String.format("Duplicate column names in %s", columns));
        }
        for (String[] row : rows) {
            if (row.length > columns.size()) {
                throw new IllegalArgumentException(
                    String.format("Row has %s values but only %s columns", row.length, columns.size()));
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(rows);
    }

    public List<String> columns() {
        return columns;
    }

    public List<String[]> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public String value(int row, int column) {
        String[] values = rows.get(row);
        return column < values.length ? values[column] : null;
    }
}
