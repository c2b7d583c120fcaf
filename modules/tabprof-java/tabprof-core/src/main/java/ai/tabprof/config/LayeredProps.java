package ai.tabprof.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One configuration layer on top of a parent source. Keys of this layer win over the parent's.
 */
public abstract class LayeredProps implements PropertiesSource {

    private final Map<String, String> props;

    protected LayeredProps(PropertiesSource parent, Map<String, String> layer) {
        Map<String, String> merged = new HashMap<>(parent.values());
        merged.putAll(layer);
        this.props = Collections.unmodifiableMap(merged);
    }

    @Override
    public Map<String, String> values() {
        return props;
    }

    /**
     * Converts profiler keys to lowercase+dot format, TABPROF__PROFILE__TOP_N to tabprof.profile.top_n, and trims
     * their values. Other keys are kept untouched.
     */
    static Map<String, String> normalize(Map<String, String> raw) {
        Map<String, String> result = new HashMap<>(raw.size());
        for (Map.Entry<String, String> prop : raw.entrySet()) {
            String key = prop.getKey();
            if (key.toLowerCase().startsWith("tabprof")) {
                result.put(key.replace("__", ".").toLowerCase(), prop.getValue().trim());
            } else {
                result.put(key, prop.getValue());
            }
        }
        return result;
    }
}
