package ai.tabprof;

import ai.tabprof.cli.render.JsonReportWriter;
import ai.tabprof.config.ProfilerConfig;
import ai.tabprof.engine.ProfilingEngine;
import ai.tabprof.schema.ProfileReport;
import ai.tabprof.source.CsvRowSource;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shortcuts for profiling CSV files from code.
 */
public class CsvProfiler {

    private final ProfilerConfig config;

    public CsvProfiler() {
        this(new ProfilerConfig());
    }

    public CsvProfiler(ProfilerConfig config) {
        this.config = config;
    }

    public ProfileReport profile(Path csv) {
        return new ProfilingEngine(config).profile(new CsvRowSource(csv, config));
    }

    /**
     * Profile a file and render the report as JSON.
     *
     * @param csv input file
     * @param out where to write the JSON, may be null
     * @return JSON report
     */
    public String profileToJson(Path csv, Path out) throws IOException {
        ProfileReport report = profile(csv);
        JsonReportWriter writer = new JsonReportWriter();
        return out == null ? writer.toJson(report) : writer.write(report, out);
    }
}
