package fol;

import fol.expr.Expr;
import fol.expr.Func;
import fol.expr.Lam;
import fol.expr.Var;
import fol.expr.VarRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Capture-avoiding substitution on de Bruijn indexed expressions.
 * <p>
 * Several operations return (or accept) expressions that are "one binder short": they contain exactly one
 * escaping index, and are not well-formed until one additional binder is added around them.
 */
public final class Substitution {

    private Substitution() {
    }

    /**
     * Replaces occurrences of a free variable by a given term.
     * Pre: t is well-formed at depth 0, so it can be inserted anywhere without shifting.
     */
    public static Expr replaceVar(String name, Expr t, Expr e) {
        final VarRef target = new VarRef.Free(name);
        return e.updateVars(0, (n, x) -> x.equals(target) ? t : new Var(x));
    }

    /**
     * Prepares to bind a free variable. The result is one binder short.
     */
    public static Expr makeBound(String name, Expr e) {
        final VarRef target = new VarRef.Free(name);
        return e.updateVars(0, (n, x) -> x.equals(target) ? Var.bound(n) : new Var(x));
    }

    /**
     * Inverse of {@link #makeBound}. The input may be one binder short.
     */
    public static Expr makeFree(String name, Expr e) {
        return e.updateVars(0, (n, x) -> isBound(x, n) ? Var.free(name) : new Var(x));
    }

    /**
     * {@link #makeFree} and {@link #replaceVar} in one go: substitutes t for the escaping index.
     * The input may be one binder short; t must be well-formed at depth 0.
     */
    public static Expr makeReplace(Expr t, Expr e) {
        return e.updateVars(0, (n, x) -> isBound(x, n) ? t : new Var(x));
    }

    /**
     * Prepares to insert k binders around a subexpression, which need not be well-formed by itself.
     */
    public static Expr makeGap(int k, Expr e) {
        return e.updateVars(0, (n, x) -> {
            if (x instanceof VarRef.Bound bound && bound.index() >= n) {
                return Var.bound(bound.index() + k);
            }
            return new Var(x);
        });
    }

    /**
     * Simultaneous substitution on the body of a k-ary lambda, where {@code ts.size() == k}.
     * The leftmost argument replaces the outermost lambda binder. Arguments may themselves contain
     * bound variables; they are shifted by the depth of the position they are inserted at.
     */
    public static Expr makeReplaceAll(List<Expr> ts, Expr e) {
        final List<Expr> reversed = new ArrayList<>(ts);
        Collections.reverse(reversed);
        return e.updateVars(0, (n, x) -> {
            if (x instanceof VarRef.Bound bound && bound.index() >= n && bound.index() - n < reversed.size()) {
                return makeGap(n, reversed.get(bound.index() - n));
            }
            return new Var(x);
        });
    }

    /**
     * Skips through lambda binders.
     */
    public static Expr lambdaBody(Expr e) {
        while (e instanceof Lam lam) {
            e = lam.body();
        }
        return e;
    }

    /**
     * Prepares to bind a free function or predicate symbol. The result is one binder short.
     */
    public static Expr makeBoundFunc(String name, Expr e) {
        final VarRef target = new VarRef.Free(name);
        return e.updateFuncs(0, (n, f, args) -> new Func(f.equals(target) ? VarRef.bound(n) : f, args));
    }

    /**
     * Substitutes a lambda (or, for nullary symbols, a plain expression) for the escaping function symbol,
     * beta-reducing every application of it.
     */
    public static Expr makeReplaceFunc(Expr lambda, Expr e) {
        final Expr body = lambdaBody(lambda);
        return e.updateFuncs(0, (n, f, args) -> isBound(f, n) ? makeReplaceAll(args, body) : new Func(f, args));
    }

    private static boolean isBound(VarRef x, int index) {
        return x instanceof VarRef.Bound bound && bound.index() == index;
    }
}
