package net.grammarkit.grammar;

import java.util.HashMap;
import java.util.Map;

/**
 * Single characters that carry a meaning in the grammar-description syntax
 * and therefore appear in parse trees as dedicated tags.
 * Each tag has a default text that stands in for the literal when the
 * parser elides its token.
 */
public enum MetaCharacter {

    /* The empty word. */
    EPSILON("epsilon", "&"),
    QUOTE("quote", "'"),
    MINUS("minus", "-"),
    PLUS("plus", "+"),
    STAR("star", "*"),
    COMMA("comma", ","),
    COLON("colon", ":"),
    DOT("dot", "."),
    DOUBLE_QUOTE("double_quote", "\""),
    PERCENTAGE("percentage", "%"),
    DOLLAR("dollar", "$"),
    AT_SIGN("at_sign", "@"),
    SHARP("sharp", "#"),
    EXCLAMATION("exclamation", "!"),
    BACKTICK("backtick", "`"),
    TICK("tick", "´"),
    CARET("caret", "^"),
    TILDE("tilde", "~"),
    QUESTION("question", "?"),
    EQUALS("equals", "="),
    SEMICOLON("semicolon", ";"),
    SLASH("slash", "/"),
    BACKSLASH("backslash", "\\"),
    OPEN_PAREN("open_paren", "("),
    CLOSE_PAREN("close_paren", ")"),
    OPEN_BRACKET("open_bracket", "["),
    CLOSE_BRACKET("close_bracket", "]"),
    OPEN_BRACE("open_brace", "{"),
    CLOSE_BRACE("close_brace", "}");

    private static final Map<String, MetaCharacter> BY_TAG;

    static {
        BY_TAG = new HashMap<String, MetaCharacter>();
        for (MetaCharacter c : values())
            BY_TAG.put(c.getTag(), c);
    }

    private final String tag;
    private final String defaultText;

    private MetaCharacter(String tag, String defaultText) {
        this.tag = tag;
        this.defaultText = defaultText;
    }

    public String getTag() {
        return tag;
    }

    public String getDefaultText() {
        return defaultText;
    }

    /**
     * Return the text of a literal given its (possibly empty) token text.
     */
    public String resolve(String literal) {
        if (literal == null || literal.isEmpty()) return defaultText;
        return literal;
    }

    /**
     * Look up the MetaCharacter with the given tag, or return null.
     */
    public static MetaCharacter forTag(String tag) {
        return BY_TAG.get(tag);
    }

}
