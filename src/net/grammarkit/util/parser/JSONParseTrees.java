package net.grammarkit.util.parser;

import java.io.Reader;
import net.grammarkit.api.parser.MappingException;
import net.grammarkit.api.parser.ParseTree;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Reading parse trees serialized as JSON.
 * A node is an object of the form {"name": tag, "children": [...]}, where
 * "children" may be omitted. A token leaf is {"name": type, "token": text}.
 * A bare string is a token leaf of type ANONYMOUS_TOKEN.
 */
public final class JSONParseTrees {

    public static final String ANONYMOUS_TOKEN = "__ANON";

    /* Prevent construction */
    private JSONParseTrees() {}

    public static ParseTree parse(String input) throws MappingException {
        return parse(new JSONTokener(input));
    }
    public static ParseTree parse(Reader input) throws MappingException {
        return parse(new JSONTokener(input));
    }

    private static ParseTree parse(JSONTokener tok) throws MappingException {
        Object value;
        try {
            value = tok.nextValue();
            if (tok.nextClean() != 0)
                throw tok.syntaxError("Unexpected garbage after JSON value");
        } catch (JSONException exc) {
            throw new MappingException("Invalid JSON parse tree: " +
                exc.getMessage(), exc);
        }
        return convert(value);
    }

    public static ParseTree convert(Object value) throws MappingException {
        if (value instanceof String)
            return new ParseTreeImpl(ANONYMOUS_TOKEN, (String) value);
        if (! (value instanceof JSONObject))
            throw new MappingException("Expected parse tree object or " +
                "token string, got " + describe(value));
        JSONObject obj = (JSONObject) value;
        Object name = obj.opt("name");
        if (! (name instanceof String))
            throw new MappingException("Parse tree node lacks a string " +
                "name: " + obj);
        if (obj.has("token")) {
            if (obj.has("children"))
                throw new MappingException("Token leaf " + name +
                    " may not have children");
            Object content = obj.get("token");
            if (! (content instanceof String))
                throw new MappingException("Token " + name +
                    " has non-string content " + describe(content));
            return new ParseTreeImpl((String) name, (String) content);
        }
        ParseTreeImpl ret = new ParseTreeImpl((String) name);
        Object children = obj.opt("children");
        if (children == null) return ret;
        if (! (children instanceof JSONArray))
            throw new MappingException("Children of " + name +
                " are not an array: " + describe(children));
        for (Object ch : (JSONArray) children) {
            ret.addChild(convert(ch));
        }
        return ret;
    }

    private static String describe(Object value) {
        if (value == null || value == JSONObject.NULL) return "null";
        return value.getClass().getSimpleName() + " " + value;
    }

}
