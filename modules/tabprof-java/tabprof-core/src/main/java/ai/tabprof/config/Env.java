package ai.tabprof.config;

import java.util.Map;

/**
 * Environment variables layer. Vars are passed using uppercase+underscore format:
 * TABPROF__PROFILE__DISTINCT_LIMIT=50000
 */
public class Env extends LayeredProps {

    public Env() {
        this(PropertiesSource.empty());
    }

    public Env(PropertiesSource parent) {
        this(parent, System.getenv());
    }

    public Env(PropertiesSource parent, Map<String, String> env) {
        super(parent, normalize(env));
    }
}
