package ai.tabprof.cli;

import ai.tabprof.ProfilerException;
import ai.tabprof.cli.render.HtmlReportWriter;
import ai.tabprof.cli.render.JsonReportWriter;
import ai.tabprof.config.Env;
import ai.tabprof.config.JavaOpts;
import ai.tabprof.config.OverrideProps;
import ai.tabprof.config.ProfilerConfig;
import ai.tabprof.engine.ProfilingEngine;
import ai.tabprof.schema.ProfileReport;
import ai.tabprof.source.CsvRowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: profile a CSV file and write the report as JSON or HTML.
 */
public class ProfilerCli {

    private static final Logger LOG = LoggerFactory.getLogger(ProfilerCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    static final String DEFAULT_HTML_OUTPUT = "report.html";

    private final PrintStream out;
    private final PrintStream err;

    public ProfilerCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        CliArgs cliArgs;
        try {
            cliArgs = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }

        ProfilerConfig config = new ProfilerConfig(new OverrideProps(new Env(new JavaOpts()), cliArgs.overrides()));
        LOG.debug("Effective configuration: {}", config);

        try {
            ProfileReport report = new ProfilingEngine(config).profile(new CsvRowSource(cliArgs.input(), config));
            switch (cliArgs.format()) {
                case HTML:
                    Path htmlPath = cliArgs.output().orElse(Paths.get(DEFAULT_HTML_OUTPUT));
                    new HtmlReportWriter().write(report, htmlPath);
                    out.println(String.format("Wrote HTML report to %s", htmlPath));
                    break;
                case JSON:
                default:
                    JsonReportWriter json = new JsonReportWriter();
                    if (cliArgs.output().isPresent()) {
                        json.write(report, cliArgs.output().get());
                    } else {
                        out.println(json.toJson(report));
                    }
            }
            return EXIT_OK;
        } catch (ProfilerException | IOException e) {
            LOG.error(String.format("Unable to profile %s", cliArgs.input()), e);
            err.println(String.format("Error: %s", e.getMessage()));
            return EXIT_FAILURE;
        }
    }

    public static void main(String[] args) {
        System.exit(new ProfilerCli(System.out, System.err).run(args));
    }
}
