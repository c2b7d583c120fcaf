package ai.tabprof.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Streaming statistics of a single column, fed one chunk at a time.
 * <p>
 * Tracks null count, exact value frequencies, a distinct-value set capped at {@code distinctLimit} and
 * numeric aggregates over the values which parse as finite numbers. Once the distinct set grows past the limit it is
 * dropped for good and the distinct count is reported as unknown.
 */
public class ColumnAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnAggregator.class);

    private final String column;
    private final int distinctLimit;

    private final FrequencyTable frequencies = new FrequencyTable();
    private final RunningNumericStats numericStats = new RunningNumericStats();
    private Set<String> distinct = new HashSet<>();
    private boolean overflowed;

    private long rows;
    private long nullCount;
    private long numericCount;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private boolean allIntegral = true;

    public ColumnAggregator(String column, int distinctLimit) {
        this.column = column;
        this.distinctLimit = distinctLimit;
    }

    /**
     * Consume the column values of one chunk. Null entries are nulls.
     *
     * @param values values in row order
     */
    public void observeChunk(List<String> values) {
        for (String value : values) {
            rows++;
            if (value == null) {
                nullCount++;
                continue;
            }
            frequencies.increment(value);
            if (!overflowed) {
                distinct.add(value);
            }
            OptionalDouble parsed = NumericParser.parse(value);
            if (parsed.isPresent()) {
                observeNumber(parsed.getAsDouble());
            }
        }
        if (!overflowed && distinct.size() > distinctLimit) {
            overflowed = true;
            distinct = null;
            LOG.warn("Column [{}] has more than {} distinct values, distinct count will not be reported", column, distinctLimit);
        }
    }

    private void observeNumber(double value) {
        numericCount++;
        numericStats.add(value);
        if (value < min) {
            min = value;
        }
        if (value > max) {
            max = value;
        }
        if (allIntegral && Math.floor(value) != value) {
            allIntegral = false;
        }
    }

    public String column() {
        return column;
    }

    public long rows() {
        return rows;
    }

    public long nullCount() {
        return nullCount;
    }

    public long numericCount() {
        return numericCount;
    }

    /**
     * @return non-null values which are not numbers
     */
    public long textCount() {
        return rows - nullCount - numericCount;
    }

    public boolean isOverflowed() {
        return overflowed;
    }

    /**
     * @return exact distinct count, empty once the distinct limit was exceeded
     */
    public OptionalLong distinctCount() {
        return overflowed ? OptionalLong.empty() : OptionalLong.of(distinct.size());
    }

    public OptionalDouble min() {
        return numericCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(min);
    }

    public OptionalDouble max() {
        return numericCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(max);
    }

    /**
     * @return true when at least one number was seen and all of them were integral
     */
    public boolean isAllIntegral() {
        return numericCount > 0 && allIntegral;
    }

    public RunningNumericStats numericStats() {
        return numericStats;
    }

    public FrequencyTable frequencies() {
        return frequencies;
    }
}
