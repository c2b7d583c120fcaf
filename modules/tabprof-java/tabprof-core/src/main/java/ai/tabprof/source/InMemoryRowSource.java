package ai.tabprof.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Row source over rows already in memory. Mostly useful for embedding and tests.
 */
public class InMemoryRowSource implements RowSource {

    private final List<Chunk> chunks;
    private boolean closed;

    public InMemoryRowSource(List<Chunk> chunks) {
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
    }

    /**
     * Split rows into chunks of chunkSize.
     *
     * @param columns   column names
     * @param rows      rows aligned with columns
     * @param chunkSize rows per chunk
     */
    public InMemoryRowSource(List<String> columns, List<String[]> rows, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size should be positive");
        }
        List<Chunk> result = new ArrayList<>(1);
        for (int from = 0; from < rows.size(); from += chunkSize) {
            int to = Math.min(rows.size(), from + chunkSize);
            result.add(new Chunk(columns, new ArrayList<>(rows.subList(from, to))));
        }
        this.chunks = Collections.unmodifiableList(result);
    }

    public static InMemoryRowSource of(String[] columns, String[]... rows) {
        return new InMemoryRowSource(Arrays.asList(columns), Arrays.asList(rows), Integer.MAX_VALUE);
    }

    @Override
    public Iterator<Chunk> chunks() {
        return chunks.iterator();
    }

    @Override
    public String describe() {
        return String.format("in-memory rows (%s chunks)", chunks.size());
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
