package proofChecking.elaborator;

import fol.Printer;
import fol.expr.And;
import fol.expr.Bottom;
import fol.expr.Eq;
import fol.expr.Exists;
import fol.expr.Expr;
import fol.expr.Forall;
import fol.expr.ForallFunc;
import fol.expr.Func;
import fol.expr.Iff;
import fol.expr.Implies;
import fol.expr.Lam;
import fol.expr.Not;
import fol.expr.Or;
import fol.expr.SchemaApp;
import fol.expr.Top;
import fol.expr.Unique;
import fol.expr.Var;
import fol.expr.VarRef;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import proofChecking.kernel.Context;
import proofChecking.kernel.Formation;
import proofChecking.kernel.KernelException;
import proofChecking.kernel.Theorem;

/**
 * Converts surface expressions to de Bruijn indices and checks their types.
 * <p>
 * Surface expressions use the {@link Expr} constructors, but every variable is referred to by name: a binder's
 * body mentions its variable as {@code Free(name)}. Only formation rules are used, so the result is a
 * {@code HasType} theorem in the given context. A binder whose name is already declared in the context is
 * declared under a primed name instead; this does not change the result, as binder names are cosmetic.
 */
public final class ExprBuilder {

    private ExprBuilder() {
    }

    public static Theorem convert(Context ctx, Expr e) {
        return convert(ctx, e, Map.of());
    }

    /**
     * @param renamed surface binder names that had to be declared under a fresh name, because the context
     *                already declares them
     */
    private static Theorem convert(Context ctx, Expr e, Map<String, String> renamed) {
        if (e instanceof Var var) {
            return Formation.varMk(ctx, freeName(var.ref(), e, renamed));
        } else if (e instanceof Func func) {
            List<Theorem> args = func.args().stream().map(arg -> convert(ctx, arg, renamed)).toList();
            return Formation.funcMk(ctx, freeName(func.head(), e, renamed), args);
        } else if (e instanceof SchemaApp schema) {
            return Formation.schemaMk(freeName(schema.head(), e, renamed), convert(ctx, schema.arg(), renamed));
        } else if (e instanceof Eq eq) {
            return Formation.eqMk(convert(ctx, eq.left(), renamed), convert(ctx, eq.right(), renamed));
        } else if (e instanceof Top) {
            return Formation.topMk(ctx);
        } else if (e instanceof Bottom) {
            return Formation.bottomMk(ctx);
        } else if (e instanceof Not not) {
            return Formation.notMk(convert(ctx, not.formula(), renamed));
        } else if (e instanceof And and) {
            return Formation.andMk(convert(ctx, and.left(), renamed), convert(ctx, and.right(), renamed));
        } else if (e instanceof Or or) {
            return Formation.orMk(convert(ctx, or.left(), renamed), convert(ctx, or.right(), renamed));
        } else if (e instanceof Implies implies) {
            return Formation.impliesMk(convert(ctx, implies.left(), renamed), convert(ctx, implies.right(), renamed));
        } else if (e instanceof Iff iff) {
            return Formation.iffMk(convert(ctx, iff.left(), renamed), convert(ctx, iff.right(), renamed));
        } else if (e instanceof Forall forall) {
            String x = Printer.freshName(forall.name(), ctx.names());
            return Formation.forallMk(convert(ctx.extendVar(x), forall.body(), bind(renamed, forall.name(), x)));
        } else if (e instanceof Exists exists) {
            String x = Printer.freshName(exists.name(), ctx.names());
            return Formation.existsMk(convert(ctx.extendVar(x), exists.body(), bind(renamed, exists.name(), x)));
        } else if (e instanceof Unique unique) {
            String x = Printer.freshName(unique.name(), ctx.names());
            return Formation.uniqueMk(convert(ctx.extendVar(x), unique.body(), bind(renamed, unique.name(), x)));
        } else if (e instanceof ForallFunc forall) {
            String f = Printer.freshName(forall.name(), ctx.names());
            Context inner = ctx.extendFunc(f, forall.arity(), forall.sort());
            return Formation.forallFuncMk(convert(inner, forall.body(), bind(renamed, forall.name(), f)));
        } else if (e instanceof Lam lam) {
            String x = Printer.freshName(lam.name(), ctx.names());
            return Formation.lamMk(convert(ctx.extendVar(x), lam.body(), bind(renamed, lam.name(), x)));
        }
        throw new IllegalStateException("Unexpected expression type: " + e.getClass());
    }

    private static Map<String, String> bind(Map<String, String> renamed, String name, String declared) {
        Map<String, String> out = new HashMap<>(renamed);
        out.put(name, declared);
        return out;
    }

    private static String freeName(VarRef ref, Expr e, Map<String, String> renamed) {
        if (ref instanceof VarRef.Free free) {
            return renamed.getOrDefault(free.name(), free.name());
        }
        throw new KernelException(KernelException.Reason.SHAPE_MISMATCH,
                "please use names for bound variables in surface expressions", e);
    }

    // Surface syntax shorthands

    public static Expr var(String name) {
        return Var.free(name);
    }

    public static Expr func(String name, Expr... args) {
        return Func.free(name, List.of(args));
    }

    public static Expr pred(String name, Expr... args) {
        return Func.free(name, List.of(args));
    }
}
