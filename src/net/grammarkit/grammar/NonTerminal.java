package net.grammarkit.grammar;

public class NonTerminal extends Symbol {

    public NonTerminal(String text) {
        super(text);
    }

    public NonTerminal clone(boolean keepFrozen) {
        return (NonTerminal) super.clone(keepFrozen);
    }

}
