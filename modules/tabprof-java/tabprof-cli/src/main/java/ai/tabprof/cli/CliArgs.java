package ai.tabprof.cli;

import ai.tabprof.cli.render.ReportFormat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static ai.tabprof.ProfilerPropertyNames.TABPROF__PROFILE__CHUNK_SIZE;
import static ai.tabprof.ProfilerPropertyNames.TABPROF__PROFILE__DISTINCT_LIMIT;
import static ai.tabprof.ProfilerPropertyNames.TABPROF__PROFILE__SEEN_HASHES_LIMIT;
import static ai.tabprof.ProfilerPropertyNames.TABPROF__PROFILE__TOP_N;

/**
 * Parsed command line. Numeric flags are passed to the configuration as overrides.
 */
public class CliArgs {

    public static final String USAGE = "Usage: tabprof <input.csv> [-o|--output PATH] [--top N] [--format json|html]"
        + " [--chunk-size N] [--distinct-limit N] [--seen-hashes-limit N]";

    private static final Map<String, String> NUMERIC_FLAGS = new HashMap<>();

    static {
        NUMERIC_FLAGS.put("--top", TABPROF__PROFILE__TOP_N);
        NUMERIC_FLAGS.put("--chunk-size", TABPROF__PROFILE__CHUNK_SIZE);
        NUMERIC_FLAGS.put("--distinct-limit", TABPROF__PROFILE__DISTINCT_LIMIT);
        NUMERIC_FLAGS.put("--seen-hashes-limit", TABPROF__PROFILE__SEEN_HASHES_LIMIT);
    }

    private final Path input;
    private final Path output;
    private final ReportFormat format;
    private final Map<String, String> overrides;

    private CliArgs(Path input, Path output, ReportFormat format, Map<String, String> overrides) {
        this.input = input;
        this.output = output;
        this.format = format;
        this.overrides = overrides;
    }

    /**
     * @param args command line arguments
     * @return parsed arguments
     * @throws IllegalArgumentException on unknown flags, missing values or a missing input path
     */
    public static CliArgs parse(String[] args) {
        String input = null;
        String output = null;
        ReportFormat format = ReportFormat.JSON;
        Map<String, String> overrides = new HashMap<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                value = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }

            if ("-o".equals(arg) || "--output".equals(arg)) {
                output = value != null ? value : requireValue(args, ++i, arg);
            } else if ("--format".equals(arg)) {
                String raw = value != null ? value : requireValue(args, ++i, arg);
                format = ReportFormat.fromString(raw)
                    .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown format %s", raw)));
            } else if (NUMERIC_FLAGS.containsKey(arg)) {
                String raw = value != null ? value : requireValue(args, ++i, arg);
                overrides.put(NUMERIC_FLAGS.get(arg), parsePositive(arg, raw));
            } else if (arg.startsWith("-") && arg.length() > 1) {
                throw new IllegalArgumentException(String.format("Unknown option %s", arg));
            } else if (input == null) {
                input = arg;
            } else {
                throw new IllegalArgumentException(String.format("Unexpected argument %s", arg));
            }
        }

        if (input == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        return new CliArgs(Paths.get(input), output == null ? null : Paths.get(output), format, overrides);
    }

    private static String requireValue(String[] args, int idx, String flag) {
        if (idx >= args.length) {
            throw new IllegalArgumentException(String.format("Option %s requires a value", flag));
        }
        return args[idx];
    }

    private static String parsePositive(String flag, String raw) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException(String.format("Option %s should be positive, got %s", flag, raw));
            }
            return String.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Option %s expects an integer, got %s", flag, raw));
        }
    }

    public Path input() {
        return input;
    }

    public Optional<Path> output() {
        return Optional.ofNullable(output);
    }

    public ReportFormat format() {
        return format;
    }

    public Map<String, String> overrides() {
        return overrides;
    }
}
