package ai.tabprof.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat view of configuration keys in lowercase+dot format, e.g. {@code tabprof.profile.top_n}.
 */
public interface PropertiesSource {

    Map<String, String> values();

    default Optional<String> getValue(String key) {
        return Optional.ofNullable(values().get(key));
    }

    /**
     * Fixed set of properties, keys are taken as is.
     */
    static PropertiesSource of(Map<String, String> props) {
        Map<String, String> copy = Collections.unmodifiableMap(new HashMap<>(props));
        return () -> copy;
    }

    static PropertiesSource empty() {
        return Collections::emptyMap;
    }
}
