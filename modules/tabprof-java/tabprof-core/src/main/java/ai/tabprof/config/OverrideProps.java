package ai.tabprof.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Explicit overrides on top of a parent source, e.g. command line flags. Null values are skipped.
 */
public class OverrideProps extends LayeredProps {

    public OverrideProps(PropertiesSource parent, Map<String, String> overrides) {
        super(parent, withoutNulls(overrides));
    }

    private static Map<String, String> withoutNulls(Map<String, String> overrides) {
        Map<String, String> result = new HashMap<>(overrides.size());
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            if (entry.getValue() != null) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }
}
