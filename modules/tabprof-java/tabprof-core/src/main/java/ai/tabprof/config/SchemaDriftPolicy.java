package ai.tabprof.config;

import java.util.Optional;

/**
 * Handling of chunks whose columns differ from the columns of the first chunk.
 */
public enum SchemaDriftPolicy {

    /**
     * Fail profiling.
     */
    STRICT,

    /**
     * Match columns by name: missing columns are null for the chunk, unknown columns are ignored.
     */
    LENIENT;

    public static Optional<SchemaDriftPolicy> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SchemaDriftPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(policy);
            }
        }
        return Optional.empty();
    }
}
