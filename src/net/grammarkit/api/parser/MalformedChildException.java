package net.grammarkit.api.parser;

/**
 * Thrown when a parse tree node's children do not have the shape its
 * mapping requires (wrong number of children or children of the wrong type).
 */
public class MalformedChildException extends MappingException {

    private final String tag;

    public MalformedChildException(String tag, String message) {
        super("Malformed " + tag + " node: " + message);
        this.tag = tag;
    }

    /**
     * The tag of the node whose children were rejected.
     */
    public String getTag() {
        return tag;
    }

}
