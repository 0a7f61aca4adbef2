package net.grammarkit.util.parser;

import java.util.ArrayList;
import java.util.List;
import net.grammarkit.api.parser.Mapper;
import net.grammarkit.api.parser.MappingException;
import net.grammarkit.api.parser.ParseTree;

public abstract class BaseCompositeMapper<C, T> implements Mapper<T> {

    public interface NodeMapper<C, T> {

        T map(ParseTree pt, List<C> children) throws MappingException;

    }

    /* Children are mapped strictly before their parent. */
    public T map(ParseTree pt) throws MappingException {
        List<ParseTree> childTrees = pt.getChildren();
        List<C> children = new ArrayList<C>(childTrees.size());
        for (ParseTree t : childTrees) {
            children.add(mapChild(t));
        }
        return mapInner(pt, children);
    }

    protected abstract T mapInner(ParseTree pt, List<C> children)
        throws MappingException;

    protected abstract C mapChild(ParseTree pt)
        throws MappingException;

}
