package ai.tabprof.config;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * JAVA_OPTS layer. Variables are passed in lowercase+dot format:
 * java -jar ... -Dtabprof.profile.top_n=10
 */
public class JavaOpts extends LayeredProps {

    public JavaOpts() {
        this(PropertiesSource.empty());
    }

    public JavaOpts(PropertiesSource parent) {
        this(
            parent,
            System.getProperties()
                .entrySet()
                .stream()
                .collect(Collectors.toMap(e -> e.getKey().toString(), e -> e.getValue().toString()))
        );
    }

    public JavaOpts(Map<String, String> systemProps) {
        this(PropertiesSource.empty(), systemProps);
    }

    public JavaOpts(PropertiesSource parent, Map<String, String> systemProps) {
        super(parent, normalize(systemProps));
    }
}
