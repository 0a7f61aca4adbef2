package net.grammarkit.util.parser;

import java.util.Collections;
import java.util.List;
import net.grammarkit.api.parser.Mapper;
import net.grammarkit.api.parser.MappingException;
import net.grammarkit.api.parser.ParseTree;

public abstract class CompositeMapper<C, T>
        extends BaseCompositeMapper<C, T> {

    private Mapper<C> childMapper;

    public CompositeMapper(Mapper<C> childMapper) {
        this.childMapper = childMapper;
    }
    public CompositeMapper() {
        this(null);
    }

    public Mapper<C> getChildMapper() {
        return childMapper;
    }
    public void setChildMapper(Mapper<C> cm) {
        childMapper = cm;
    }

    protected C mapChild(ParseTree pt) throws MappingException {
        if (childMapper == null)
            throw new IllegalStateException("No child mapper configured");
        return childMapper.map(pt);
    }

    public static <C, T> CompositeMapper<C, T> of(
            final NodeMapper<C, T> reduce, Mapper<C> map) {
        return new CompositeMapper<C, T>(map) {
            protected T mapInner(ParseTree pt, List<C> children)
                    throws MappingException {
                return reduce.map(pt, children);
            }
        };
    }

    public static <T> CompositeMapper<T, List<T>> aggregate(Mapper<T> nested,
            final boolean makeImmutable) {
        return new CompositeMapper<T, List<T>>(nested) {
            protected List<T> mapInner(ParseTree pt,
                                       List<T> children) {
                if (makeImmutable)
                    children = Collections.unmodifiableList(children);
                return children;
            }
        };
    }
    public static <T> CompositeMapper<T, List<T>> aggregate(
            Mapper<T> nested) {
        return aggregate(nested, false);
    }

}
