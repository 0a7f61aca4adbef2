package net.grammarkit.api.parser;

/**
 * Generic superclass for checked exceptions of the tree processing modules.
 */
public class ParserException extends Exception {

    public ParserException() {
        super();
    }
    public ParserException(String message) {
        super(message);
    }
    public ParserException(Throwable cause) {
        super(cause);
    }
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }

}
