package net.grammarkit.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One right-hand side of a grammar rule: an ordered sequence of symbols.
 * The rendering of a production is the concatenation of its symbols'
 * renderings; its length is the number of symbols. Frozen productions
 * compare their symbol sequences element-wise, so that the variant of each
 * symbol matters as well as the text.
 * Freezing a production freezes its symbols and pins them: they cannot be
 * unlocked until the production is unlocked again.
 */
public class Production extends LockableValue {

    private List<Symbol> symbols;
    private List<Symbol> symbolsView;

    public Production() {
        setSymbolList(new ArrayList<Symbol>());
    }

    private void setSymbolList(List<Symbol> list) {
        symbols = list;
        symbolsView = Collections.unmodifiableList(list);
    }

    public List<Symbol> getSymbols() {
        return symbolsView;
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public void add(Symbol sym) {
        checkUnlocked();
        symbols.add(checkSymbol(sym));
    }
    public void add(int index, Symbol sym) {
        checkUnlocked();
        symbols.add(index, checkSymbol(sym));
    }

    public Symbol remove(int index) {
        checkUnlocked();
        return symbols.remove(index);
    }

    public void clear() {
        checkUnlocked();
        symbols.clear();
    }

    private static Symbol checkSymbol(Symbol sym) {
        if (sym == null)
            throw new NullPointerException(
                "Production symbols may not be null");
        return sym;
    }

    protected String render() {
        StringBuilder sb = new StringBuilder();
        for (Symbol s : symbols) sb.append(s.toString());
        return sb.toString();
    }

    protected int measure() {
        return symbols.size();
    }

    protected void prepareFreeze() {
        for (Symbol s : symbols) s.hold();
    }

    protected void afterUnlock() {
        for (Symbol s : symbols) s.release();
    }

    protected void copyContents() {
        List<Symbol> copied = new ArrayList<Symbol>(symbols.size());
        for (Symbol s : symbols) copied.add(s.clone(s.isFrozen()));
        setSymbolList(copied);
    }

    protected boolean contentEquals(LockableValue other) {
        return symbols.equals(((Production) other).symbols);
    }

    public Production clone(boolean keepFrozen) {
        return (Production) super.clone(keepFrozen);
    }

    public static Production of(List<? extends Symbol> symbols) {
        Production ret = new Production();
        for (Symbol s : symbols) ret.add(s);
        return ret;
    }
    public static Production of(Symbol... symbols) {
        return of(Arrays.asList(symbols));
    }

}
