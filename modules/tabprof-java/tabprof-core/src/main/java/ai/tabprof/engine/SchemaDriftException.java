package ai.tabprof.engine;

import ai.tabprof.ProfilerException;

import java.util.List;

/**
 * A chunk came with a column list different from the first chunk.
 */
public class SchemaDriftException extends ProfilerException {

    private final long chunkIndex;

    public SchemaDriftException(long chunkIndex, List<String> expected, List<String> actual) {
        super(String.format("Chunk %s has columns %s, expected %s", chunkIndex, actual, expected));
        this.chunkIndex = chunkIndex;
    }

    public long getChunkIndex() {
        return chunkIndex;
    }
}
