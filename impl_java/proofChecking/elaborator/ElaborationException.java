package proofChecking.elaborator;

import proofChecking.kernel.KernelException;

/**
 * The first failure of a proof script, together with the innermost proof or declaration node that failed.
 */
public class ElaborationException extends RuntimeException {

    private final KernelException.Reason reason;
    private final transient Object node;

    public ElaborationException(Object node, KernelException cause) {
        super(cause.getMessage() + "\n  in: " + node, cause);
        this.reason = cause.reason();
        this.node = node;
    }

    public ElaborationException(KernelException.Reason reason, String message, Object node) {
        super(reason + ": " + message + "\n  in: " + node);
        this.reason = reason;
        this.node = node;
    }

    public KernelException.Reason reason() {
        return reason;
    }

    public Object node() {
        return node;
    }
}
