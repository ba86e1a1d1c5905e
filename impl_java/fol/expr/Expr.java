package fol.expr;

import java.util.List;

/**
 * Terms, formulas, and the lambda-abstracted functions/predicates built from them.
 * <p>
 * Equality is structural and ignores the display names of binders; free names matter.
 * An expression is well-formed at binder depth d iff every {@code Bound(i)} on its path has i &lt; d.
 */
public sealed interface Expr
        permits Var, Func, SchemaApp, Eq, Top, Bottom, Not, And, Or, Implies, Iff, Forall, Exists, Unique,
        ForallFunc, Lam {

    /**
     * Rebuilds the expression, replacing every variable leaf by {@code update.apply(n, ref)}
     * where n is the number of binders on top of the leaf.
     */
    Expr updateVars(int depth, VarUpdate update);

    /**
     * Rebuilds the expression, replacing every function application (arguments already updated) by
     * {@code update.apply(n, head, args)}.
     */
    Expr updateFuncs(int depth, FuncUpdate update);

    /**
     * @param used  names which must not be reused by binders
     * @param stack display names of enclosing binders, innermost first
     */
    String show(List<String> used, List<String> stack);

    @FunctionalInterface
    interface VarUpdate {
        Expr apply(int depth, VarRef ref);
    }

    @FunctionalInterface
    interface FuncUpdate {
        Expr apply(int depth, VarRef head, List<Expr> args);
    }
}
