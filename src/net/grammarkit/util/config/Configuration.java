package net.grammarkit.util.config;

/**
 * A source of string-valued settings, looked up by dotted keys such as
 * "grammarkit.transformer.strictProductions".
 */
public interface Configuration {

    /**
     * System properties first, then environment variables.
     */
    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    /**
     * The value for the given key, or null if it is not set.
     */
    String get(String key);

}
