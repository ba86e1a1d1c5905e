package proofChecking.kernel;

import java.util.Objects;

/**
 * A judgment derived under a context. Instances can only be created by the rules in {@link Formation}
 * and {@link Deduction} (and by {@link #weaken}), so every theorem has a derivation from the empty context.
 */
public final class Theorem {

    private final Context context;
    private final Judgment judgment;

    Theorem(Context context, Judgment judgment) {
        this.context = context;
        this.judgment = judgment;
    }

    public Context context() {
        return context;
    }

    public Judgment judgment() {
        return judgment;
    }

    /**
     * Restates the judgment under {@code target}, which must be this theorem's context with zero or more
     * entries added in front.
     */
    public Theorem weaken(Context target) {
        if (!target.hasSuffix(context)) {
            throw new KernelException(KernelException.Reason.CONTEXT_MISMATCH,
                    "weakening target does not extend the theorem's context", target);
        }
        if (target.equals(context)) return this;
        return new Theorem(target, judgment);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Theorem other)) return false;
        return context.equals(other.context) && judgment.equals(other.judgment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(context, judgment);
    }

    @Override
    public String toString() {
        return "\n" + context + "|- " + judgment.show(context.names()) + "\n";
    }
}
