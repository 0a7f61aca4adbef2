package net.grammarkit.grammar;

/**
 * A grammar symbol wrapping a text payload.
 * The payload is rendered unchanged; escaping of meta-characters happens
 * before a Symbol is constructed. Symbols of different classes never compare
 * equal, even if their texts are.
 */
public abstract class Symbol extends LockableValue {

    private String text;

    protected Symbol(String text) {
        setText(text);
    }

    public String getText() {
        return text;
    }
    public final void setText(String text) {
        checkUnlocked();
        if (text == null)
            throw new NullPointerException("Symbol text may not be null");
        this.text = text;
    }

    protected String render() {
        return text;
    }

    protected int measure() {
        return text.length();
    }

    public Symbol clone(boolean keepFrozen) {
        return (Symbol) super.clone(keepFrozen);
    }

}
