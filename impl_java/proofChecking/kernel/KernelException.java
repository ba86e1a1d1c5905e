package proofChecking.kernel;

/**
 * Thrown when a rule is applied to premises that do not satisfy its guard. No theorem is produced.
 */
public class KernelException extends RuntimeException {

    public enum Reason {
        /** A rule was applied to a judgment of the wrong kind or connective. */
        SHAPE_MISMATCH,
        /** Combined premises have different contexts, or a weakening target does not extend the context. */
        CONTEXT_MISMATCH,
        /** Wrong argument count, or a negative declared arity. */
        ARITY_MISMATCH,
        UNBOUND_NAME,
        /** A context already declares the name. */
        DUPLICATE_NAME,
        /** Two formulas which have to be equal are not. */
        FORMULA_MISMATCH,
        EMPTY_BLOCK,
        /** A generalization case which is recognized but not implemented. */
        UNSUPPORTED
    }

    private final Reason reason;
    private final transient Object offending;

    public KernelException(Reason reason, String message, Object offending) {
        super(reason + ": " + message + (offending == null ? "" : "\n  at: " + offending));
        this.reason = reason;
        this.offending = offending;
    }

    public Reason reason() {
        return reason;
    }

    public Object offending() {
        return offending;
    }
}
