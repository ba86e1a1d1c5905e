package proofChecking.kernel;

import static proofChecking.kernel.KernelException.Reason.CONTEXT_MISMATCH;
import static proofChecking.kernel.KernelException.Reason.FORMULA_MISMATCH;
import static proofChecking.kernel.KernelException.Reason.SHAPE_MISMATCH;
import static proofChecking.kernel.KernelException.Reason.UNBOUND_NAME;

import fol.expr.Expr;
import fol.type.FunctionType;
import fol.type.Type;

/**
 * Pattern checks shared by the rules. Each one either returns the matched part or rejects.
 */
final class Guards {

    private Guards() {
    }

    static Expr provable(Theorem thm) {
        if (thm.judgment() instanceof Judgment.Provable provable) {
            return provable.formula();
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a provable formula", thm.judgment());
    }

    static <T extends Expr> T provable(Theorem thm, Class<T> shape) {
        Expr formula = provable(thm);
        if (shape.isInstance(formula)) {
            return shape.cast(formula);
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a provable " + shape.getSimpleName(), thm.judgment());
    }

    static Expr hasType(Theorem thm, Type type) {
        if (thm.judgment() instanceof Judgment.HasType hasType && hasType.type().equals(type)) {
            return hasType.expr();
        }
        throw new KernelException(SHAPE_MISMATCH, "expected an expression of type " + type, thm.judgment());
    }

    static Judgment.HasType functionTyped(Theorem thm) {
        if (thm.judgment() instanceof Judgment.HasType hasType && hasType.type() instanceof FunctionType) {
            return hasType;
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a function or predicate", thm.judgment());
    }

    static void sameContext(Theorem first, Theorem... others) {
        for (Theorem other : others) {
            if (!first.context().equals(other.context())) {
                throw new KernelException(CONTEXT_MISMATCH, "premises have different contexts", other);
            }
        }
    }

    static void sameFormula(Expr expected, Expr actual) {
        if (!expected.equals(actual)) {
            throw new KernelException(FORMULA_MISMATCH, "expected " + expected + ", got " + actual, actual);
        }
    }

    static ContextEntry lookup(Context ctx, String name) {
        return ctx.lookup(name)
                .orElseThrow(() -> new KernelException(UNBOUND_NAME, "unknown name " + name, name));
    }

    /**
     * The front declaration of a context-changing rule's premise.
     */
    static ContextEntry.VarDecl frontDecl(Theorem thm) {
        if (thm.context().front().orElse(null) instanceof ContextEntry.VarDecl decl) {
            return decl;
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a declaration in front of the context", thm);
    }

    static ContextEntry.VarDecl frontTermDecl(Theorem thm) {
        ContextEntry.VarDecl decl = frontDecl(thm);
        if (!decl.type().equals(Type.TERM)) {
            throw new KernelException(SHAPE_MISMATCH, "expected a term variable in front of the context", decl);
        }
        return decl;
    }

    /**
     * A function or predicate declaration; nullary term symbols are plain variables.
     */
    static FunctionType frontFuncType(Theorem thm) {
        ContextEntry.VarDecl decl = frontDecl(thm);
        if (decl.type() instanceof FunctionType type && !type.isTerm()) {
            return type;
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a function or predicate in front of the context", decl);
    }

    static ContextEntry.Hypothesis frontHyp(Theorem thm) {
        if (thm.context().front().orElse(null) instanceof ContextEntry.Hypothesis hyp) {
            return hyp;
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a hypothesis in front of the context", thm);
    }
}
