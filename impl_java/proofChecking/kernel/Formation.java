package proofChecking.kernel;

import static proofChecking.kernel.Guards.frontFuncType;
import static proofChecking.kernel.Guards.frontTermDecl;
import static proofChecking.kernel.Guards.functionTyped;
import static proofChecking.kernel.Guards.hasType;
import static proofChecking.kernel.Guards.lookup;
import static proofChecking.kernel.Guards.sameContext;
import static proofChecking.kernel.KernelException.Reason.ARITY_MISMATCH;
import static proofChecking.kernel.KernelException.Reason.SHAPE_MISMATCH;

import fol.Substitution;
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
import fol.type.FunctionType;
import fol.type.SchemaType;
import fol.type.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Formation rules: derive that an expression is well-formed and has a given type.
 * The context-changing rules are the only way an expression gets bound variables.
 */
public final class Formation {

    private Formation() {
    }

    public static Theorem varMk(Context ctx, String name) {
        ContextEntry entry = lookup(ctx, name);
        if (!(entry instanceof ContextEntry.VarDecl decl) || !decl.type().equals(Type.TERM)) {
            throw new KernelException(SHAPE_MISMATCH, name + " is not a term variable", entry);
        }
        return new Theorem(ctx, new Judgment.HasType(Var.free(name), Type.TERM));
    }

    public static Theorem funcMk(Context ctx, String name, List<Theorem> args) {
        ContextEntry entry = lookup(ctx, name);
        if (!(entry instanceof ContextEntry.VarDecl decl) || !(decl.type() instanceof FunctionType type)) {
            throw new KernelException(SHAPE_MISMATCH, name + " is not a function or predicate", entry);
        }
        if (type.arity() != args.size()) {
            throw new KernelException(ARITY_MISMATCH,
                    name + " expects " + type.arity() + " arguments, got " + args.size(), entry);
        }
        if (type.isTerm()) {
            return varMk(ctx, name);
        }
        List<Expr> exprs = new ArrayList<>(args.size());
        for (Theorem arg : args) {
            if (!arg.context().equals(ctx)) {
                throw new KernelException(KernelException.Reason.CONTEXT_MISMATCH,
                        "argument of " + name + " has a different context", arg);
            }
            exprs.add(hasType(arg, Type.TERM));
        }
        return new Theorem(ctx, new Judgment.HasType(Func.free(name, exprs), new FunctionType(0, type.sort())));
    }

    public static Theorem schemaMk(String name, Theorem arg) {
        Judgment.HasType argType = functionTyped(arg);
        ContextEntry entry = lookup(arg.context(), name);
        if (!(entry instanceof ContextEntry.VarDecl decl) || !(decl.type() instanceof SchemaType type)) {
            throw new KernelException(SHAPE_MISMATCH, name + " is not a schema", entry);
        }
        if (!type.argType().equals(argType.type())) {
            throw new KernelException(SHAPE_MISMATCH,
                    name + " expects an argument of type " + type.argType(), arg.judgment());
        }
        return new Theorem(arg.context(),
                new Judgment.HasType(new SchemaApp(new VarRef.Free(name), argType.expr()), type.resultType()));
    }

    public static Theorem eqMk(Theorem left, Theorem right) {
        sameContext(left, right);
        return formula(left, new Eq(hasType(left, Type.TERM), hasType(right, Type.TERM)));
    }

    public static Theorem topMk(Context ctx) {
        return new Theorem(ctx, new Judgment.HasType(new Top(), Type.FORMULA));
    }

    public static Theorem bottomMk(Context ctx) {
        return new Theorem(ctx, new Judgment.HasType(new Bottom(), Type.FORMULA));
    }

    public static Theorem notMk(Theorem formula) {
        return formula(formula, new Not(hasType(formula, Type.FORMULA)));
    }

    public static Theorem andMk(Theorem left, Theorem right) {
        sameContext(left, right);
        return formula(left, new And(hasType(left, Type.FORMULA), hasType(right, Type.FORMULA)));
    }

    public static Theorem orMk(Theorem left, Theorem right) {
        sameContext(left, right);
        return formula(left, new Or(hasType(left, Type.FORMULA), hasType(right, Type.FORMULA)));
    }

    public static Theorem impliesMk(Theorem left, Theorem right) {
        sameContext(left, right);
        return formula(left, new Implies(hasType(left, Type.FORMULA), hasType(right, Type.FORMULA)));
    }

    public static Theorem iffMk(Theorem left, Theorem right) {
        sameContext(left, right);
        return formula(left, new Iff(hasType(left, Type.FORMULA), hasType(right, Type.FORMULA)));
    }

    // Context-changing rules

    public static Theorem forallMk(Theorem body) {
        String x = frontTermDecl(body).name();
        Expr e = hasType(body, Type.FORMULA);
        return popFormula(body, new Forall(x, Substitution.makeBound(x, e)));
    }

    public static Theorem existsMk(Theorem body) {
        String x = frontTermDecl(body).name();
        Expr e = hasType(body, Type.FORMULA);
        return popFormula(body, new Exists(x, Substitution.makeBound(x, e)));
    }

    public static Theorem uniqueMk(Theorem body) {
        String x = frontTermDecl(body).name();
        Expr e = hasType(body, Type.FORMULA);
        return popFormula(body, new Unique(x, Substitution.makeBound(x, e)));
    }

    public static Theorem forallFuncMk(Theorem body) {
        FunctionType type = frontFuncType(body);
        String f = body.context().front().orElseThrow().name();
        Expr e = hasType(body, Type.FORMULA);
        return popFormula(body, new ForallFunc(f, type.arity(), type.sort(), Substitution.makeBoundFunc(f, e)));
    }

    public static Theorem lamMk(Theorem body) {
        String x = frontTermDecl(body).name();
        Judgment.HasType hasType = functionTyped(body);
        FunctionType type = (FunctionType) hasType.type();
        return new Theorem(body.context().rest(), new Judgment.HasType(
                new Lam(x, Substitution.makeBound(x, hasType.expr())),
                new FunctionType(type.arity() + 1, type.sort())));
    }

    private static Theorem formula(Theorem premise, Expr e) {
        return new Theorem(premise.context(), new Judgment.HasType(e, Type.FORMULA));
    }

    private static Theorem popFormula(Theorem premise, Expr e) {
        return new Theorem(premise.context().rest(), new Judgment.HasType(e, Type.FORMULA));
    }
}
