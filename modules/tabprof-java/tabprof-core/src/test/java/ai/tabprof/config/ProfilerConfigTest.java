package ai.tabprof.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static ai.tabprof.ProfilerPropertyNames.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;

class ProfilerConfigTest {

    @Test
    public void testDefaults() {
        ProfilerConfig config = new ProfilerConfig(PropertiesSource.empty());

        assertThat("Wrong default", config.topN(), equalTo(5));
        assertThat("Wrong default", config.chunkSize(), equalTo(100000));
        assertThat("Wrong default", config.distinctLimit(), equalTo(100000));
        assertThat("Wrong default", config.seenHashesLimit(), equalTo(1000000));
        assertThat("Only empty string should be null by default", config.nullValues(), containsInAnyOrder(""));
        assertThat("Wrong default", config.schemaDriftPolicy(), equalTo(SchemaDriftPolicy.STRICT));
        assertThat("Integer detection should be off", config.isDetectInteger(), equalTo(false));
        assertThat("Delimiter should be absent", config.delimiter().isPresent(), equalTo(false));
        assertThat("Verbose should be off", config.isVerbose(), equalTo(false));
    }

    @Test
    public void testCustomValues() {
        Map<String, String> props = new HashMap<>(1);
        props.put(TABPROF__PROFILE__TOP_N, "10");
        props.put(TABPROF__PROFILE__DISTINCT_LIMIT, "50");
        props.put(TABPROF__PROFILE__NULL_VALUES, "NA, null");
        props.put(TABPROF__PROFILE__SCHEMA_DRIFT, "Lenient");
        props.put(TABPROF__PROFILE__DETECT_INTEGER, "true");
        props.put(TABPROF__SOURCE__DELIMITER, "tab");

        ProfilerConfig config = new ProfilerConfig(PropertiesSource.of(props));

        assertThat("Wrong value", config.topN(), equalTo(10));
        assertThat("Wrong value", config.distinctLimit(), equalTo(50));
        assertThat("Wrong null values", config.nullValues(), containsInAnyOrder("", "NA", "null"));
        assertThat("NA should be null", config.isNullValue("NA"), equalTo(true));
        assertThat("Java null should be null", config.isNullValue(null), equalTo(true));
        assertThat("Regular value should not be null", config.isNullValue("n/a"), equalTo(false));
        assertThat("Wrong policy", config.schemaDriftPolicy(), equalTo(SchemaDriftPolicy.LENIENT));
        assertThat("Integer detection should be on", config.isDetectInteger(), equalTo(true));
        assertThat("Wrong delimiter", config.delimiter().get(), equalTo('\t'));
    }

    @Test
    public void testInvalidValuesFallBackToDefaults() {
        Map<String, String> props = new HashMap<>(1);
        props.put(TABPROF__PROFILE__TOP_N, "many");
        props.put(TABPROF__PROFILE__CHUNK_SIZE, "0");
        props.put(TABPROF__PROFILE__SEEN_HASHES_LIMIT, "-5");
        props.put(TABPROF__PROFILE__SCHEMA_DRIFT, "whatever");
        props.put(TABPROF__SOURCE__DELIMITER, ";;");

        ProfilerConfig config = new ProfilerConfig(PropertiesSource.of(props));

        assertThat("Non-integer should fall back", config.topN(), equalTo(ProfilerConfig.TOP_N_DEFAULT));
        assertThat("Zero should fall back", config.chunkSize(), equalTo(ProfilerConfig.CHUNK_SIZE_DEFAULT));
        assertThat("Negative should fall back", config.seenHashesLimit(), equalTo(ProfilerConfig.SEEN_HASHES_LIMIT_DEFAULT));
        assertThat("Unknown policy should fall back", config.schemaDriftPolicy(), equalTo(SchemaDriftPolicy.STRICT));
        assertThat("Multi-char delimiter should be ignored", config.delimiter().isPresent(), equalTo(false));
    }

    @Test
    public void testToStringShowsOnlyProfilerKeys() {
        Map<String, String> props = new HashMap<>(1);
        props.put(TABPROF__PROFILE__TOP_N, "10");
        props.put("java.home", "/opt/jdk");

        String printed = new ProfilerConfig(PropertiesSource.of(props)).toString();

        assertThat("Profiler key should be printed", printed, containsString("tabprof.profile.top_n=10"));
        assertThat("Foreign key should not be printed", printed, not(containsString("java.home")));
    }
}
