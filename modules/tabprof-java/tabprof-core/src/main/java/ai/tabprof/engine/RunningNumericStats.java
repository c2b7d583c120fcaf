package ai.tabprof.engine;

import java.util.OptionalDouble;

/**
 * Online mean and variance (Welford's algorithm). Values are not retained.
 * <p>
 * Any double is accepted. A NaN or infinite value makes mean and variance NaN or infinite from then on, following
 * IEEE 754 arithmetic; {@link NumericParser} only passes finite values here.
 * <p>
 * Not thread-safe, one instance per column.
 */
public class RunningNumericStats {

    private long count;
    private double mean;
    private double sumSquaredDeviations;

    public void add(double x) {
        count++;
        double delta = x - mean;
        mean += delta / count;
        double delta2 = x - mean;
        sumSquaredDeviations += delta * delta2;
    }

    public long count() {
        return count;
    }

    /**
     * @return mean of all added values, 0.0 when nothing was added
     */
    public double mean() {
        return mean;
    }

    public double sumSquaredDeviations() {
        return sumSquaredDeviations;
    }

    /**
     * Sample variance with Bessel's correction.
     *
     * @return variance, or empty for fewer than 2 values
     */
    public OptionalDouble variance() {
        if (count < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sumSquaredDeviations / (count - 1));
    }

    public OptionalDouble std() {
        OptionalDouble variance = variance();
        return variance.isPresent() ? OptionalDouble.of(Math.sqrt(variance.getAsDouble())) : OptionalDouble.empty();
    }
}
