package ai.tabprof.cli.render;

import ai.tabprof.cli.jackson.ColumnSummarySerializer;
import ai.tabprof.cli.jackson.ProfileReportSerializer;
import ai.tabprof.schema.ColumnSummary;
import ai.tabprof.schema.ProfileReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a report as indented JSON.
 */
public class JsonReportWriter {

    private final ObjectMapper mapper;

    public JsonReportWriter() {
        SimpleModule module = new SimpleModule("tabprof-report");
        module.addSerializer(ProfileReport.class, new ProfileReportSerializer());
        module.addSerializer(ColumnSummary.class, new ColumnSummarySerializer());

        mapper = new ObjectMapper();
        mapper.registerModule(module);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(ProfileReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }

    public String write(ProfileReport report, Path out) throws IOException {
        String json = toJson(report);
        Files.write(out, json.getBytes(StandardCharsets.UTF_8));
        return json;
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
