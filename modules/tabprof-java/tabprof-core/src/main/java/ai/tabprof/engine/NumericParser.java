package ai.tabprof.engine;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Parses cell values as 64-bit floats. Accepts plain decimal and scientific notation with optional sign and
 * surrounding whitespace. NaN, infinities, overflowing literals and Java-only forms (hex, d/f suffixes) are rejected.
 */
public final class NumericParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericParser() {
    }

    public static OptionalDouble parse(String value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || !NUMBER.matcher(trimmed).matches()) {
            return OptionalDouble.empty();
        }
        double parsed;
        try {
            parsed = Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
        if (Double.isInfinite(parsed) || Double.isNaN(parsed)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(parsed);
    }
}
