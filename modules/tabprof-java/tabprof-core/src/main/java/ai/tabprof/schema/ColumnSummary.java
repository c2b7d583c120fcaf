package ai.tabprof.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ColumnSummary {

    private final long nullCount;
    private final double nullPct;
    private final Long distinctCount;
    private final boolean distinctCountApprox;
    private final InferredType type;
    private final long numericCount;
    private final NumericSummary numeric;
    private final List<ValueCount> topValues;

    public ColumnSummary(long nullCount,
                         double nullPct,
                         Long distinctCount,
                         boolean distinctCountApprox,
                         InferredType type,
                         long numericCount,
                         NumericSummary numeric,
                         List<ValueCount> topValues) {
        this.nullCount = nullCount;
        this.nullPct = nullPct;
        this.distinctCount = distinctCount;
        this.distinctCountApprox = distinctCountApprox;
        this.type = type;
        this.numericCount = numericCount;
        this.numeric = numeric;
        this.topValues = Collections.unmodifiableList(topValues);
    }

    public long getNullCount() {
        return nullCount;
    }

    public double getNullPct() {
        return nullPct;
    }

    /**
     * @return exact distinct count of non-null values, null once the distinct limit was exceeded
     */
    public Long getDistinctCount() {
        return distinctCount;
    }

    public boolean isDistinctCountApprox() {
        return distinctCountApprox;
    }

    public InferredType getType() {
        return type;
    }

    public long getNumericCount() {
        return numericCount;
    }

    /**
     * @return min/max/mean/std block, present only when the column has numeric values
     */
    public Optional<NumericSummary> getNumeric() {
        return Optional.ofNullable(numeric);
    }

    public List<ValueCount> getTopValues() {
        return topValues;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(10);
        result.put("null_count", nullCount);
        result.put("null_pct", nullPct);
        result.put("distinct_count", distinctCount);
        result.put("distinct_count_approx", distinctCountApprox);
        result.put("inferred_type", type.value());
        if (numeric != null) {
            result.putAll(numeric.toMap());
        }
        result.put("top_values", topValues);
        return result;
    }
}
