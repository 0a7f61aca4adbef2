package net.grammarkit.api.parser;

/**
 * Thrown when a parse tree node's tag has no registered mapping.
 * This means that the grammar producing the tree and the mapper consuming it
 * have diverged.
 */
public class UnrecognizedTagException extends MappingException {

    private final String tag;

    public UnrecognizedTagException(String tag) {
        super("Cannot map parse tree node type " + tag);
        this.tag = tag;
    }
    public UnrecognizedTagException(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    /**
     * The tag that could not be mapped.
     */
    public String getTag() {
        return tag;
    }

}
