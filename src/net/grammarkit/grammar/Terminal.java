package net.grammarkit.grammar;

public class Terminal extends Symbol {

    public Terminal(String text) {
        super(text);
    }

    public Terminal clone(boolean keepFrozen) {
        return (Terminal) super.clone(keepFrozen);
    }

}
