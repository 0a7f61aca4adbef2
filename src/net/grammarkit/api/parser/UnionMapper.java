package net.grammarkit.api.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Mapper dispatching to other mappers depending on the parse tree name.
 * A UnionMapper maintains a set of *children*, which are identified by
 * String names. The map() method picks a child whose key matches the name of
 * the parse tree passed to map() and delegates further processing to that
 * child.
 * Children are registered via the add() method, or by directly accessing the
 * collection of children via getChildren().
 */
public class UnionMapper<T> implements Mapper<T> {

    private final Map<String, Mapper<? extends T>> children;

    /**
     * Create a new UnionMapper with no children.
     */
    public UnionMapper() {
        this.children = new LinkedHashMap<String, Mapper<? extends T>>();
    }

    /**
     * Return the children of this UnionMapper.
     */
    public Map<String, Mapper<? extends T>> getChildren() {
        return children;
    }

    /**
     * Convenience method to register a new child.
     * Registering a name twice is an error, since the tag table would
     * otherwise silently depend on registration order.
     */
    public void add(String name, Mapper<? extends T> child) {
        if (children.containsKey(name))
            throw new IllegalArgumentException("Duplicate mapper for " +
                "parse tree node type " + name);
        children.put(name, child);
    }

    /**
     * Test whether the given parse tree can be processed by this UnionMapper.
     */
    public boolean canMap(ParseTree tree) {
        return getChildren().containsKey(tree.getName());
    }

    /**
     * Map the given parse tree to an object or throw an exception.
     * This locates the child whose key is the name of the given parse tree
     * and delegates to the child's map() method. If there is no matching
     * child, this throws an UnrecognizedTagException.
     */
    public T map(ParseTree tree) throws MappingException {
        Mapper<? extends T> child = getChildren().get(tree.getName());
        if (child == null)
            throw new UnrecognizedTagException(tree.getName());
        return child.map(tree);
    }

}
