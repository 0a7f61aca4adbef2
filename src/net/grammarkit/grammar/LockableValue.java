package net.grammarkit.grammar;

import net.grammarkit.util.UniqueCounter;
import net.grammarkit.util.Util;

/**
 * A value that can be mutated freely until freeze() is called and is
 * immutable afterwards.
 * While mutable, hash code and equality are based on a process-unique
 * identity assigned at construction, so that distinct objects under
 * construction never collide. Freezing caches the string rendering and the
 * length of the value; from then on, hash code and equality derive from the
 * cached rendering, and any mutator throws a LockedMutationException.
 * unlock() reverses freezing.
 * Subclasses supply the rendering and length rules, and must call
 * checkUnlocked() at the start of every mutator.
 * Instances are not thread-safe while mutable; frozen instances may be
 * shared freely.
 */
public abstract class LockableValue implements Cloneable {

    private long identity;
    private boolean frozen;
    private String cachedString;
    private int cachedLength;
    private int hash;
    private int holders;

    protected LockableValue() {
        initIdentity();
    }

    private void initIdentity() {
        identity = UniqueCounter.INSTANCE.get();
        hash = Util.hashLong(identity);
    }

    /**
     * Compute the string rendering of this value.
     */
    protected abstract String render();

    /**
     * Compute the length of this value.
     */
    protected abstract int measure();

    /**
     * Called by freeze() before the caches are computed.
     * Subclasses holding other LockableValues pin them here (see hold()).
     */
    protected void prepareFreeze() {}

    /**
     * Called by unlock() after the caches have been discarded.
     */
    protected void afterUnlock() {}

    /**
     * Called by clone() on the copy to replace shared mutable state with
     * independent copies.
     */
    protected void copyContents() {}

    /**
     * Additional equality test for two frozen values of the same class whose
     * renderings are equal.
     */
    protected boolean contentEquals(LockableValue other) {
        return true;
    }

    protected final long getIdentity() {
        return identity;
    }

    public final boolean isFrozen() {
        return frozen;
    }

    protected final void checkUnlocked() {
        if (frozen)
            throw new LockedMutationException("Attributes cannot be " +
                "changed after the object is frozen: " +
                getClass().getSimpleName() + " " + cachedString);
    }

    public void freeze() {
        if (frozen) return;
        prepareFreeze();
        cachedString = render();
        cachedLength = measure();
        hash = cachedString.hashCode();
        frozen = true;
    }

    /**
     * Unfreeze this value.
     * Fails with a LockedMutationException while a frozen container holds
     * this value (see hold()).
     */
    public void unlock() {
        if (! frozen) return;
        if (holders > 0)
            throw new LockedMutationException("Cannot unlock a value held " +
                "by " + holders + " frozen container(s): " +
                getClass().getSimpleName() + " " + cachedString);
        frozen = false;
        cachedString = null;
        cachedLength = 0;
        hash = Util.hashLong(identity);
        afterUnlock();
    }

    /**
     * Freeze this value and pin it on behalf of a frozen container whose
     * cached rendering includes it. Each call must be matched by one
     * release().
     */
    protected final void hold() {
        freeze();
        holders++;
    }

    protected final void release() {
        if (holders > 0) holders--;
    }

    protected final boolean isHeld() {
        return (holders > 0);
    }

    /**
     * Create an independent deep copy of this value.
     * The copy has a fresh identity; it is frozen if keepFrozen is true and
     * mutable otherwise, regardless of the state of this value.
     */
    public LockableValue clone(boolean keepFrozen) {
        LockableValue copy;
        try {
            copy = (LockableValue) super.clone();
        } catch (CloneNotSupportedException exc) {
            throw new AssertionError(exc);
        }
        copy.frozen = false;
        copy.cachedString = null;
        copy.cachedLength = 0;
        copy.holders = 0;
        copy.initIdentity();
        copy.copyContents();
        if (keepFrozen) copy.freeze();
        return copy;
    }

    public String toString() {
        return (frozen) ? cachedString : render();
    }

    public int length() {
        return (frozen) ? cachedLength : measure();
    }

    public int hashCode() {
        return hash;
    }

    public boolean equals(Object other) {
        if (other == this) return true;
        if (other == null) return false;
        if (! (other instanceof LockableValue))
            throw new IncompatibleComparisonException("Cannot compare " +
                getClass().getName() + " to " + other.getClass().getName());
        LockableValue lo = (LockableValue) other;
        if (! frozen || ! lo.frozen)
            return (identity == lo.identity);
        return (getClass() == lo.getClass() &&
                cachedString.equals(lo.cachedString) &&
                contentEquals(lo));
    }

}
