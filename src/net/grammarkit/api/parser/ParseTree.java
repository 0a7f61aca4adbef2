package net.grammarkit.api.parser;

import java.util.List;
import net.grammarkit.api.NamedValue;

/**
 * A single parse tree node, as produced by an external grammar-description
 * parser.
 * A parse tree has a name (either the name of the underlying token or the
 * tag of the grammar rule that gave rise to the node), an optional token
 * (present on leaf nodes), and a list of child nodes.
 */
public interface ParseTree extends NamedValue {

    /**
     * A token is a piece of input text associated with a token type name.
     */
    interface Token extends NamedValue {

        /**
         * The text this token encompasses.
         */
        String getContent();

    }

    /**
     * The token this ParseTree directly corresponds to, or null.
     * Only leaf nodes may have tokens; some nodes may have no children
     * although they do not correspond to a token (e.g. elided literals).
     */
    Token getToken();

    /**
     * An immutable list of this node's children.
     */
    List<ParseTree> getChildren();

}
