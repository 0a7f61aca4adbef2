package net.grammarkit.grammar;

/**
 * Thrown when an attribute of a frozen LockableValue is about to be changed.
 * Callers that need to derive a modified value should clone it unfrozen
 * first.
 */
public class LockedMutationException extends IllegalStateException {

    public LockedMutationException(String message) {
        super(message);
    }

}
