package ai.tabprof.cli.jackson;

import ai.tabprof.schema.ColumnSummary;
import ai.tabprof.schema.NumericSummary;
import ai.tabprof.schema.ValueCount;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Optional;

/**
 * Writes a column summary in the report wire format. The numeric block (min, max, mean, std) is written only for
 * columns with numeric values, std may be null. Non-finite statistics, e.g. a mean that overflowed, are written as
 * null since JSON has no NaN or Infinity.
 */
public class ColumnSummarySerializer extends StdSerializer<ColumnSummary> {

    public ColumnSummarySerializer() {
        this(null);
    }

    public ColumnSummarySerializer(Class<ColumnSummary> t) {
        super(t);
    }

    @Override
    public void serialize(ColumnSummary value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("null_count", value.getNullCount());
        gen.writeNumberField("null_pct", value.getNullPct());
        if (value.getDistinctCount() == null) {
            gen.writeNullField("distinct_count");
        } else {
            gen.writeNumberField("distinct_count", value.getDistinctCount());
        }
        gen.writeBooleanField("distinct_count_approx", value.isDistinctCountApprox());
        gen.writeStringField("inferred_type", value.getType().value());

        Optional<NumericSummary> numeric = value.getNumeric();
        if (numeric.isPresent()) {
            NumericSummary n = numeric.get();
            writeFinite(gen, "min", n.getMin());
            writeFinite(gen, "max", n.getMax());
            writeFinite(gen, "mean", n.getMean());
            writeFinite(gen, "std", n.getStd());
        }

        gen.writeArrayFieldStart("top_values");
        for (ValueCount top : value.getTopValues()) {
            gen.writeStartObject();
            gen.writeStringField("value", top.getValue());
            gen.writeNumberField("count", top.getCount());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeFinite(JsonGenerator gen, String name, Double value) throws IOException {
        if (value == null || value.isNaN() || value.isInfinite()) {
            gen.writeNullField(name);
        } else {
            gen.writeNumberField(name, value);
        }
    }
}
