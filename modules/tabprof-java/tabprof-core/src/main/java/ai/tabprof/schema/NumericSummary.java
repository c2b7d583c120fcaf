package ai.tabprof.schema;

import java.util.LinkedHashMap;
import java.util.Map;

public class NumericSummary {

    private final double min;
    private final double max;
    private final double mean;
    private final Double std;

    public NumericSummary(double min, double max, double mean, Double std) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.std = std;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    /**
     * @return sample standard deviation, null for a single value
     */
    public Double getStd() {
        return std;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(4);
        result.put("min", min);
        result.put("max", max);
        result.put("mean", mean);
        result.put("std", std);
        return result;
    }
}
