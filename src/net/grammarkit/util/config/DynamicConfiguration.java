package net.grammarkit.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layered configuration: explicitly put() values override the sources,
 * which are consulted in the order they were added.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    /* "grammarkit.log.level" is read from GRAMMARKIT_LOG_LEVEL. */
    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(envName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    /* Lookups are cached, including misses. */
    public String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        data.put(key, ret);
        return ret;
    }

    public void put(String key, String value) {
        data.put(key, value);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    public static String envName(String key) {
        return key.toUpperCase().replace(".", "_");
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
