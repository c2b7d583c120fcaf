package ai.tabprof;

public abstract class ProfilerPropertyNames {

    /**
     * Number of most frequent values reported per column.
     */
    public static final String TABPROF__PROFILE__TOP_N = "tabprof.profile.top_n";

    /**
     * Rows per chunk read from the row source.
     */
    public static final String TABPROF__PROFILE__CHUNK_SIZE = "tabprof.profile.chunk_size";

    /**
     * Max number of distinct values tracked per column before the distinct count becomes approximate.
     */
    public static final String TABPROF__PROFILE__DISTINCT_LIMIT = "tabprof.profile.distinct_limit";

    /**
     * Max number of row hashes tracked for duplicate detection.
     */
    public static final String TABPROF__PROFILE__SEEN_HASHES_LIMIT = "tabprof.profile.seen_hashes_limit";

    /**
     * Comma separated list of values treated as null. Empty string is always included.
     */
    public static final String TABPROF__PROFILE__NULL_VALUES = "tabprof.profile.null_values";

    /**
     * What to do when a chunk has different columns than the first one: strict or lenient.
     */
    public static final String TABPROF__PROFILE__SCHEMA_DRIFT = "tabprof.profile.schema_drift";

    /**
     * Report "integer" instead of "float" for numeric columns with integral values only.
     */
    public static final String TABPROF__PROFILE__DETECT_INTEGER = "tabprof.profile.detect_integer";

    /**
     * CSV field separator.
     */
    public static final String TABPROF__SOURCE__DELIMITER = "tabprof.source.delimiter";

    /**
     * Log chunk progress at INFO level.
     */
    public static final String TABPROF__VERBOSE = "tabprof.verbose";

}
