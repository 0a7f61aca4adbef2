package net.grammarkit.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarkit.api.parser.ParseTree;

public class ParseTreeImpl implements ParseTree {

    public static class TokenImpl implements Token {

        private final String name;
        private final String content;

        public TokenImpl(String name, String content) {
            if (name == null)
                throw new NullPointerException(
                    "Token name may not be null");
            if (content == null)
                throw new NullPointerException(
                    "Token content may not be null");
            this.name = name;
            this.content = content;
        }

        public String toString() {
            return String.format("%s(%s, %s)", getClass().getSimpleName(),
                                 getName(), getContent());
        }

        public String getName() {
            return name;
        }

        public String getContent() {
            return content;
        }

    }

    private final String name;
    private final Token token;
    private final List<ParseTree> children;
    private final List<ParseTree> childrenView;

    {
        children = new ArrayList<ParseTree>();
        childrenView = Collections.unmodifiableList(children);
    }

    public ParseTreeImpl(Token token) {
        this.name = token.getName();
        this.token = token;
    }
    public ParseTreeImpl(String tokenName, String content) {
        this(new TokenImpl(tokenName, content));
    }
    public ParseTreeImpl(String name, ParseTree... children) {
        if (name == null)
            throw new NullPointerException(
                "Parse tree name may not be null");
        this.name = name;
        this.token = null;
        for (ParseTree ch : children) addChild(ch);
    }

    public String toString() {
        if (token != null) return token.toString();
        return String.format("Tree(%s, %s)", getName(), getChildren());
    }

    public String getName() {
        return name;
    }

    public Token getToken() {
        return token;
    }

    public List<ParseTree> getChildren() {
        return childrenView;
    }

    public void addChild(ParseTree ch) {
        if (token != null)
            throw new IllegalStateException(
                "Token leaves may not have children");
        if (ch == null)
            throw new NullPointerException(
                "Parse tree children may not be null");
        children.add(ch);
    }

}
