package net.grammarkit.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammarkit.api.parser.MalformedChildException;
import net.grammarkit.api.parser.Mapper;
import net.grammarkit.api.parser.MappingException;
import net.grammarkit.api.parser.ParseTree;
import net.grammarkit.api.parser.UnionMapper;
import net.grammarkit.util.Util;
import net.grammarkit.util.config.Configuration;
import net.grammarkit.util.parser.BaseCompositeMapper;
import net.grammarkit.util.parser.CompositeMapper;

/**
 * Converts the parse tree of a grammar description into grammar symbols and
 * productions.
 * For the rule "S -> a A | a", the parse tree looks like this:
 *
 *     productions
 *       non_terminal_start
 *         non_terminal    S
 *       non_terminals
 *         production
 *           terminal      a
 *           non_terminal  A
 *         production
 *           terminal      a
 *       end_symbol
 *
 * Nodes are mapped bottom-up. Token leaves map to their content; every other
 * node is reduced according to the TagKind its tag is registered with:
 * - Meta-character tags (see MetaCharacter) become one Terminal holding the
 *   literal token text, or the tag's default text if there is none.
 * - "terminal" and "non_terminal" concatenate their children into a single
 *   Terminal or NonTerminal.
 * - "production" collects the Terminal and NonTerminal children into a new
 *   Production.
 * - "non_terminal_start" wraps its single NonTerminal into a Production.
 * - Structural tags map to an unmodifiable list of their children.
 * Any other tag raises an UnrecognizedTagException.
 * All values are returned mutable; freezing is left to the caller.
 */
public class TreeTransformer implements Mapper<Object> {

    public static final String STRICT_PRODUCTIONS_KEY =
        "grammarkit.transformer.strictProductions";

    public static final String TERMINAL = "terminal";
    public static final String NON_TERMINAL = "non_terminal";
    public static final String PRODUCTION = "production";
    public static final String START_SYMBOL = "non_terminal_start";

    public static final Set<String> DEFAULT_STRUCTURAL_TAGS =
        Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(
            "productions", "non_terminals", "end_symbol")));

    private static final Logger LOGGER = Logger.getLogger("TreeTransformer");

    private final UnionMapper<Object> handlers;
    private final Map<String, TagKind> tagTable;
    private final boolean strictProductions;

    public TreeTransformer(boolean strictProductions,
                           Collection<String> structuralTags) {
        this.handlers = new UnionMapper<Object>();
        this.tagTable = new LinkedHashMap<String, TagKind>();
        this.strictProductions = strictProductions;
        for (MetaCharacter c : MetaCharacter.values())
            register(c.getTag(), TagKind.LITERAL);
        register(TERMINAL, TagKind.TERMINAL);
        register(NON_TERMINAL, TagKind.NON_TERMINAL);
        register(PRODUCTION, TagKind.PRODUCTION);
        register(START_SYMBOL, TagKind.START_SYMBOL);
        for (String tag : structuralTags)
            register(tag, TagKind.STRUCTURAL);
    }
    public TreeTransformer(Configuration config) {
        this(Util.isTrue(config.get(STRICT_PRODUCTIONS_KEY)),
             DEFAULT_STRUCTURAL_TAGS);
    }
    public TreeTransformer() {
        this(Configuration.DEFAULT);
    }

    private void register(final String tag, final TagKind kind) {
        Mapper<?> handler;
        if (kind == TagKind.STRUCTURAL) {
            handler = CompositeMapper.aggregate(this, true);
        } else {
            handler = CompositeMapper.of(
                new BaseCompositeMapper.NodeMapper<Object, Object>() {
                    public Object map(ParseTree pt, List<Object> children)
                            throws MappingException {
                        return reduce(tag, kind, children);
                    }
                }, this);
        }
        handlers.add(tag, handler);
        tagTable.put(tag, kind);
    }

    /**
     * The tags this transformer accepts, in registration order.
     */
    public Map<String, TagKind> getTagTable() {
        return Collections.unmodifiableMap(tagTable);
    }

    public boolean isStrictProductions() {
        return strictProductions;
    }

    /**
     * Transform the given tree.
     * The result is a String for token leaves, a Symbol or a Production for
     * the respective tags, and a List of such for structural nodes.
     */
    public Object map(ParseTree pt) throws MappingException {
        if (pt.getToken() != null)
            return pt.getToken().getContent();
        Object ret = handlers.map(pt);
        LOGGER.log(Level.FINER, "{0} -> {1}", new Object[] { pt.getName(),
            ret });
        return ret;
    }

    /**
     * Transform the given tree and return all productions in it, in
     * document order.
     */
    public List<Production> transformProductions(ParseTree root)
            throws MappingException {
        List<Production> ret = new ArrayList<Production>();
        collectProductions(map(root), ret);
        return ret;
    }

    private static void collectProductions(Object value,
                                           List<Production> drain) {
        if (value instanceof Production) {
            drain.add((Production) value);
        } else if (value instanceof List) {
            for (Object item : (List<?>) value)
                collectProductions(item, drain);
        }
    }

    protected Object reduce(String tag, TagKind kind, List<Object> children)
            throws MappingException {
        switch (kind) {
            case LITERAL:
                return resolveLiteral(tag, children);
            case TERMINAL:
                return new Terminal(concatenate(tag, children));
            case NON_TERMINAL:
                return new NonTerminal(concatenate(tag, children));
            case PRODUCTION:
                return assembleProduction(tag, children);
            case START_SYMBOL:
                return wrapStartSymbol(tag, children);
            default:
                throw new AssertionError("This should not happen!");
        }
    }

    protected Terminal resolveLiteral(String tag, List<Object> children)
            throws MalformedChildException {
        MetaCharacter c = MetaCharacter.forTag(tag);
        if (c == null)
            throw new AssertionError("Literal tag " + tag +
                " is not a meta-character");
        StringBuilder sb = new StringBuilder();
        for (Object ch : children) {
            if (! (ch instanceof String))
                throw new MalformedChildException(tag,
                    "expected literal token, got " + describe(ch));
            sb.append((String) ch);
        }
        return new Terminal(c.resolve(sb.toString()));
    }

    protected String concatenate(String tag, List<Object> children)
            throws MalformedChildException {
        if (children.isEmpty())
            throw new MalformedChildException(tag,
                "expected at least one token");
        StringBuilder sb = new StringBuilder();
        for (Object ch : children) {
            if (ch instanceof String) {
                sb.append((String) ch);
            } else if (ch instanceof Symbol) {
                sb.append(((Symbol) ch).getText());
            } else {
                throw new MalformedChildException(tag,
                    "expected token or symbol, got " + describe(ch));
            }
        }
        return sb.toString();
    }

    // Children that are not symbols are structural and ignored unless
    // strictProductions is set.
    protected Production assembleProduction(String tag,
            List<Object> children) throws MalformedChildException {
        Production ret = new Production();
        for (Object ch : children) {
            if (ch instanceof Terminal || ch instanceof NonTerminal) {
                ret.add((Symbol) ch);
            } else if (strictProductions) {
                throw new MalformedChildException(tag,
                    "expected symbol, got " + describe(ch));
            } else {
                LOGGER.log(Level.FINEST, "Ignoring non-symbol child {0} " +
                    "of {1}", new Object[] { describe(ch), tag });
            }
        }
        LOGGER.log(Level.FINE, "Assembled production {0}", ret);
        return ret;
    }

    protected Production wrapStartSymbol(String tag, List<Object> children)
            throws MalformedChildException {
        if (children.size() != 1)
            throw new MalformedChildException(tag,
                "expected exactly one non-terminal, got " + children.size() +
                " children");
        Object ch = children.get(0);
        if (! (ch instanceof NonTerminal))
            throw new MalformedChildException(tag,
                "expected non-terminal, got " + describe(ch));
        Production ret = new Production();
        ret.add((NonTerminal) ch);
        return ret;
    }

    private static String describe(Object value) {
        if (value == null) return "null";
        return value.getClass().getSimpleName() + " " + value;
    }

}
