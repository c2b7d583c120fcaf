package ai.tabprof.report;

import ai.tabprof.engine.ColumnAggregator;
import ai.tabprof.engine.DuplicateDetector;
import ai.tabprof.engine.RunningNumericStats;
import ai.tabprof.schema.ColumnSummary;
import ai.tabprof.schema.InferredType;
import ai.tabprof.schema.NumericSummary;
import ai.tabprof.schema.ProfileReport;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Turns final aggregator state into a {@link ProfileReport}. Works on accumulated counts only.
 */
public class ReportAssembler {

    /**
     * Share of numeric values among all rows required to call a column numeric.
     */
    public static final double NUMERIC_THRESHOLD = 0.9;

    private static final int NULL_PCT_SCALE = 6;

    private final int topN;
    private final boolean detectInteger;

    public ReportAssembler(int topN, boolean detectInteger) {
        this.topN = topN;
        this.detectInteger = detectInteger;
    }

    public ProfileReport assemble(long rows, long chunks, DuplicateDetector duplicates, List<ColumnAggregator> columns) {
        Map<String, ColumnSummary> summaries = new LinkedHashMap<>();
        for (ColumnAggregator column : columns) {
            summaries.put(column.column(), summarize(column, rows));
        }
        return new ProfileReport(rows, duplicates.duplicates(), duplicates.isApproximate(), chunks, summaries);
    }

    public ColumnSummary summarize(ColumnAggregator column, long rows) {
        OptionalLong distinct = column.distinctCount();
        return new ColumnSummary(
            column.nullCount(),
            nullPct(column.nullCount(), rows),
            distinct.isPresent() ? distinct.getAsLong() : null,
            column.isOverflowed(),
            inferType(column.numericCount(), rows, column.isAllIntegral()),
            column.numericCount(),
            numericSummary(column),
            column.frequencies().top(topN)
        );
    }

    private NumericSummary numericSummary(ColumnAggregator column) {
        if (column.numericCount() == 0) {
            return null;
        }
        RunningNumericStats stats = column.numericStats();
        OptionalDouble std = stats.std();
        return new NumericSummary(
            column.min().getAsDouble(),
            column.max().getAsDouble(),
            stats.mean(),
            std.isPresent() ? std.getAsDouble() : null
        );
    }

    public InferredType inferType(long numericCount, long rows, boolean allIntegral) {
        if (rows == 0) {
            return InferredType.EMPTY;
        }
        double frac = (double) numericCount / rows;
        if (frac >= NUMERIC_THRESHOLD) {
            return detectInteger && allIntegral ? InferredType.INTEGER : InferredType.FLOAT;
        }
        return InferredType.STRING;
    }

    /**
     * Null share rounded half-even to 6 decimals, 0.0 for no rows.
     */
    public static double nullPct(long nullCount, long rows) {
        if (rows == 0) {
            return 0.0;
        }
        return new BigDecimal((double) nullCount / rows)
            .setScale(NULL_PCT_SCALE, RoundingMode.HALF_EVEN)
            .doubleValue();
    }
}
