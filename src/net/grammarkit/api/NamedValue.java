package net.grammarkit.api;

/**
 * A generic interface for objects carrying a textual name.
 * Parse tree nodes are named after the grammar rule (the *tag*) or the token
 * type they stem from.
 */
public interface NamedValue {

    /**
     * The name of this object.
     */
    String getName();

}
