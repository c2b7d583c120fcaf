package ai.tabprof.cli.jackson;

import ai.tabprof.schema.ColumnSummary;
import ai.tabprof.schema.ProfileReport;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Map;

public class ProfileReportSerializer extends StdSerializer<ProfileReport> {

    public ProfileReportSerializer() {
        this(null);
    }

    public ProfileReportSerializer(Class<ProfileReport> t) {
        super(t);
    }

    @Override
    public void serialize(ProfileReport value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("rows", value.getRows());
        gen.writeNumberField("duplicate_row_count", value.getDuplicateRowCount());
        gen.writeObjectFieldStart("columns");
        for (Map.Entry<String, ColumnSummary> column : value.getColumns().entrySet()) {
            provider.defaultSerializeField(column.getKey(), column.getValue(), gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
