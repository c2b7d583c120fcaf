package ai.tabprof.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static ai.tabprof.ProfilerPropertyNames.*;

/**
 * Profiler configuration.
 */
public class ProfilerConfig implements PropertiesSource {

    private static final Logger LOG = LoggerFactory.getLogger(ProfilerConfig.class);

    public static final int TOP_N_DEFAULT = 5;
    public static final int CHUNK_SIZE_DEFAULT = 100000;
    public static final int DISTINCT_LIMIT_DEFAULT = 100000;
    public static final int SEEN_HASHES_LIMIT_DEFAULT = 1000000;

    private final Map<String, String> props;
    private final Set<String> nullValues;
    private final SchemaDriftPolicy schemaDriftPolicy;

    /**
     * Default override order, from higher priority to lowest:
     * 1. Process environment variables
     * 2. Java process system properties
     */
    public ProfilerConfig() {
        this(
            new Env(
                new JavaOpts()
            )
        );
    }

    public ProfilerConfig(PropertiesSource props) {
        this.props = props.values();
        this.nullValues = buildNullValues(this.props.get(TABPROF__PROFILE__NULL_VALUES));
        this.schemaDriftPolicy = buildSchemaDriftPolicy(this.props.get(TABPROF__PROFILE__SCHEMA_DRIFT));
    }

    private Set<String> buildNullValues(String raw) {
        Set<String> result = new LinkedHashSet<>();
        // empty string is always null
        result.add("");
        if (raw != null) {
            for (String value : raw.split(",")) {
                result.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private SchemaDriftPolicy buildSchemaDriftPolicy(String raw) {
        if (raw == null || raw.isEmpty()) {
            return SchemaDriftPolicy.STRICT;
        }
        Optional<SchemaDriftPolicy> policy = SchemaDriftPolicy.fromString(raw);
        if (!policy.isPresent()) {
            LOG.error("Unknown schema drift policy {}. Falling back to {}", raw, SchemaDriftPolicy.STRICT);
        }
        return policy.orElse(SchemaDriftPolicy.STRICT);
    }

    public int topN() {
        return getPositiveInteger(TABPROF__PROFILE__TOP_N, TOP_N_DEFAULT);
    }

    public int chunkSize() {
        return getPositiveInteger(TABPROF__PROFILE__CHUNK_SIZE, CHUNK_SIZE_DEFAULT);
    }

    public int distinctLimit() {
        return getPositiveInteger(TABPROF__PROFILE__DISTINCT_LIMIT, DISTINCT_LIMIT_DEFAULT);
    }

    public int seenHashesLimit() {
        return getPositiveInteger(TABPROF__PROFILE__SEEN_HASHES_LIMIT, SEEN_HASHES_LIMIT_DEFAULT);
    }

    public Set<String> nullValues() {
        return nullValues;
    }

    public boolean isNullValue(String value) {
        return value == null || nullValues.contains(value);
    }

    public SchemaDriftPolicy schemaDriftPolicy() {
        return schemaDriftPolicy;
    }

    public boolean isDetectInteger() {
        return isTrue(TABPROF__PROFILE__DETECT_INTEGER);
    }

    public Optional<Character> delimiter() {
        Optional<String> value = getValue(TABPROF__SOURCE__DELIMITER);
        if (!value.isPresent()) {
            return Optional.empty();
        }
        String delimiter = value.get();
        if ("\\t".equals(delimiter) || "tab".equalsIgnoreCase(delimiter)) {
            return Optional.of('\t');
        }
        if (delimiter.length() != 1) {
            LOG.error("Delimiter should be a single character, got {}. Using default", delimiter);
            return Optional.empty();
        }
        return Optional.of(delimiter.charAt(0));
    }

    public boolean isVerbose() {
        return isTrue(TABPROF__VERBOSE);
    }

    protected Integer getPositiveInteger(String key, Integer defaultValue) {
        int value = getInteger(key, defaultValue);
        if (value <= 0) {
            LOG.error("Value of {} should be positive, got {}. Returning default value {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    protected Integer getInteger(String key, Integer defaultValue) {
        String value = props.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.error("Unable to read integer value from {}. Returning default value {}", value, defaultValue);
            return defaultValue;
        }
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(props);
    }

    protected final boolean isTrue(String key) {
        String value = props.get(key);
        return value != null && Boolean.TRUE.toString().equalsIgnoreCase(value.trim());
    }

    @Override
    public Optional<String> getValue(String key) {
        String value = props.get(key);
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    @Override
    public String toString() {
        if (props == null || props.isEmpty()) {
            return "{}";
        }
        return "\n" + props.keySet().stream()
            .filter(key -> key.toLowerCase().startsWith("tabprof"))
            .sorted()
            .map(key -> key + "=" + props.get(key))
            .collect(Collectors.joining("\n"));
    }
}
