package ai.tabprof.engine;

import ai.tabprof.config.ProfilerConfig;
import ai.tabprof.config.SchemaDriftPolicy;
import ai.tabprof.report.ReportAssembler;
import ai.tabprof.schema.ProfileReport;
import ai.tabprof.source.Chunk;
import ai.tabprof.source.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single pass profiler. Reads the source chunk by chunk, feeds every row to the duplicate detector and every column
 * to its aggregator, then assembles the report.
 * <p>
 * Columns are fixed by the first non-empty chunk. Each call of {@link #profile(RowSource)} starts from scratch,
 * the engine itself keeps no state between calls.
 */
public class ProfilingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ProfilingEngine.class);

    private final ProfilerConfig config;
    private final ReportAssembler assembler;

    public ProfilingEngine() {
        this(new ProfilerConfig());
    }

    public ProfilingEngine(ProfilerConfig config) {
        this.config = config;
        this.assembler = new ReportAssembler(config.topN(), config.isDetectInteger());
    }

    /**
     * Profile the whole source. The source is closed afterwards.
     *
     * @param source rows to profile
     * @return report, empty when the source has no rows
     * @throws ai.tabprof.ProfilerException when the source can't be read or its schema changes in strict mode
     */
    public ProfileReport profile(RowSource source) {
        long started = System.currentTimeMillis();
        LOG.info("Profiling {} with top_n={}, distinct_limit={}, seen_hashes_limit={}",
            source.describe(), config.topN(), config.distinctLimit(), config.seenHashesLimit());

        ProfileState state = null;
        long chunkIndex = 0;
        try (RowSource rows = source) {
            Iterator<Chunk> chunks = rows.chunks();
            while (chunks.hasNext()) {
                Chunk chunk = chunks.next();
                if (chunk.isEmpty()) {
                    continue;
                }
                if (state == null) {
                    state = new ProfileState(chunk.columns());
                }
                state.observe(chunk, chunkIndex++);
                logProgress(chunkIndex, state.rows);
            }
        }

        if (state == null) {
            LOG.info("No rows in {}", source.describe());
            return ProfileReport.empty();
        }

        ProfileReport report = assembler.assemble(state.rows, chunkIndex, state.duplicates, state.aggregators);
        LOG.info("Profiled {} rows in {} chunks: {} duplicates, {} columns, took {} ms",
            report.getRows(), report.getChunks(), report.getDuplicateRowCount(), report.getColumns().size(),
            System.currentTimeMillis() - started);
        return report;
    }

    private void logProgress(long chunks, long rows) {
        if (config.isVerbose()) {
            LOG.info("Chunk {} done, {} rows so far", chunks, rows);
        } else {
            LOG.debug("Chunk {} done, {} rows so far", chunks, rows);
        }
    }

    /**
     * Everything accumulated during one profiling run.
     */
    private final class ProfileState {

        private final List<String> columns;
        private final int[] identity;
        private final List<ColumnAggregator> aggregators;
        private final DuplicateDetector duplicates;
        private final Set<String> reportedDrift = new HashSet<>();
        private long rows;

        private ProfileState(List<String> columns) {
            this.columns = columns;
            this.identity = new int[columns.size()];
            this.aggregators = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                identity[i] = i;
                aggregators.add(new ColumnAggregator(columns.get(i), config.distinctLimit()));
            }
            this.duplicates = new DuplicateDetector(config.seenHashesLimit());
        }

        private void observe(Chunk chunk, long chunkIndex) {
            int[] mapping = resolveColumns(chunk.columns(), chunkIndex);
            int width = columns.size();
            int size = chunk.size();
            String[][] byColumn = new String[width][size];

            for (int r = 0; r < size; r++) {
                String[] row = new String[width];
                for (int c = 0; c < width; c++) {
                    String value = mapping[c] < 0 ? null : chunk.value(r, mapping[c]);
                    if (config.isNullValue(value)) {
                        value = null;
                    }
                    row[c] = value;
                    byColumn[c][r] = value;
                }
                duplicates.observe(row);
            }

            for (int c = 0; c < width; c++) {
                aggregators.get(c).observeChunk(Arrays.asList(byColumn[c]));
            }
            rows += size;
        }

        /**
         * Position of each profiled column in the chunk, -1 when the chunk doesn't have it.
         */
        private int[] resolveColumns(List<String> chunkColumns, long chunkIndex) {
            if (chunkColumns.equals(columns)) {
                return identity;
            }
            if (config.schemaDriftPolicy() == SchemaDriftPolicy.STRICT) {
                throw new SchemaDriftException(chunkIndex, columns, chunkColumns);
            }
            Map<String, Integer> positions = new HashMap<>(chunkColumns.size());
            for (int i = 0; i < chunkColumns.size(); i++) {
                positions.put(chunkColumns.get(i), i);
            }
            int[] mapping = new int[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                Integer position = positions.get(columns.get(c));
                mapping[c] = position == null ? -1 : position;
                if (position == null && reportedDrift.add(columns.get(c))) {
                    LOG.warn("Column [{}] is missing in chunk {}, its values are counted as nulls", columns.get(c), chunkIndex);
                }
            }
            for (String column : chunkColumns) {
                if (!columns.contains(column) && reportedDrift.add(column)) {
                    LOG.warn("Column [{}] first seen in chunk {} is not profiled", column, chunkIndex);
                }
            }
            return mapping;
        }
    }
}
