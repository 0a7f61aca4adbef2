package net.grammarkit.grammar;

/**
 * Thrown when a LockableValue is compared for equality with an object that
 * is not a LockableValue.
 */
public class IncompatibleComparisonException
        extends IllegalArgumentException {

    public IncompatibleComparisonException(String message) {
        super(message);
    }

}
