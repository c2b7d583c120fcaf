package ai.tabprof.source;

import java.util.Iterator;

/**
 * Ordered stream of row chunks. Chunks and the rows inside them come in dataset order.
 */
public interface RowSource extends AutoCloseable {

    /**
     * Chunks of the dataset. A source without rows yields no chunks.
     * Iteration may throw {@link RowSourceException} on malformed input.
     *
     * @return chunk iterator, single use
     */
    Iterator<Chunk> chunks();

    /**
     * @return human readable description for logs
     */
    String describe();

    @Override
    void close();

}
