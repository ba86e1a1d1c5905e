package proofChecking.kernel;

import static proofChecking.kernel.Guards.frontFuncType;
import static proofChecking.kernel.Guards.frontHyp;
import static proofChecking.kernel.Guards.frontTermDecl;
import static proofChecking.kernel.Guards.functionTyped;
import static proofChecking.kernel.Guards.hasType;
import static proofChecking.kernel.Guards.lookup;
import static proofChecking.kernel.Guards.provable;
import static proofChecking.kernel.Guards.sameContext;
import static proofChecking.kernel.Guards.sameFormula;
import static proofChecking.kernel.KernelException.Reason.SHAPE_MISMATCH;

import fol.Printer;
import fol.Substitution;
import fol.expr.And;
import fol.expr.Bottom;
import fol.expr.Eq;
import fol.expr.Exists;
import fol.expr.Expr;
import fol.expr.Forall;
import fol.expr.ForallFunc;
import fol.expr.Iff;
import fol.expr.Implies;
import fol.expr.Lam;
import fol.expr.Not;
import fol.expr.Or;
import fol.expr.Top;
import fol.expr.Unique;
import fol.expr.Var;
import fol.type.FunctionType;
import fol.type.Sort;
import fol.type.Type;

/**
 * Introduction and elimination rules of natural deduction.
 * <p>
 * Pre and post: every formula in a {@code Provable} judgment is a well-formed formula in its context.
 */
public final class Deduction {

    private Deduction() {
    }

    public static Theorem assumption(Context ctx, String name) {
        ContextEntry entry = lookup(ctx, name);
        if (!(entry instanceof ContextEntry.Hypothesis hyp)) {
            throw new KernelException(SHAPE_MISMATCH, name + " is not a hypothesis", entry);
        }
        return provableIn(ctx, hyp.formula());
    }

    public static Theorem andIntro(Theorem p, Theorem q) {
        sameContext(p, q);
        return provableIn(p, new And(provable(p), provable(q)));
    }

    public static Theorem andLeft(Theorem pq) {
        return provableIn(pq, provable(pq, And.class).left());
    }

    public static Theorem andRight(Theorem pq) {
        return provableIn(pq, provable(pq, And.class).right());
    }

    /**
     * @param q a formula-typing theorem for the right disjunct
     */
    public static Theorem orLeft(Theorem p, Theorem q) {
        sameContext(p, q);
        return provableIn(p, new Or(provable(p), hasType(q, Type.FORMULA)));
    }

    /**
     * @param p a formula-typing theorem for the left disjunct
     */
    public static Theorem orRight(Theorem p, Theorem q) {
        sameContext(p, q);
        return provableIn(q, new Or(hasType(p, Type.FORMULA), provable(q)));
    }

    public static Theorem orElim(Theorem pq, Theorem pr, Theorem qr) {
        sameContext(pq, pr, qr);
        Or or = provable(pq, Or.class);
        Implies left = provable(pr, Implies.class);
        Implies right = provable(qr, Implies.class);
        sameFormula(or.left(), left.left());
        sameFormula(or.right(), right.left());
        sameFormula(left.right(), right.right());
        return provableIn(pq, left.right());
    }

    /**
     * Discharges the hypothesis in front of the context (context-changing).
     */
    public static Theorem impliesIntro(Theorem q) {
        ContextEntry.Hypothesis hyp = frontHyp(q);
        return new Theorem(q.context().rest(), new Judgment.Provable(new Implies(hyp.formula(), provable(q))));
    }

    public static Theorem impliesElim(Theorem pq, Theorem p) {
        sameContext(pq, p);
        Implies implies = provable(pq, Implies.class);
        sameFormula(implies.left(), provable(p));
        return provableIn(pq, implies.right());
    }

    public static Theorem notIntro(Theorem pf) {
        Implies implies = provable(pf, Implies.class);
        if (!(implies.right() instanceof Bottom)) {
            throw new KernelException(SHAPE_MISMATCH, "expected an implication of ⊥", pf.judgment());
        }
        return provableIn(pf, new Not(implies.left()));
    }

    public static Theorem notElim(Theorem np, Theorem p) {
        sameContext(np, p);
        sameFormula(provable(np, Not.class).formula(), provable(p));
        return provableIn(np, new Bottom());
    }

    public static Theorem iffIntro(Theorem pq, Theorem qp) {
        sameContext(pq, qp);
        Implies forward = provable(pq, Implies.class);
        Implies backward = provable(qp, Implies.class);
        sameFormula(forward.left(), backward.right());
        sameFormula(forward.right(), backward.left());
        return provableIn(pq, new Iff(forward.left(), forward.right()));
    }

    public static Theorem iffLeft(Theorem pq, Theorem p) {
        sameContext(pq, p);
        Iff iff = provable(pq, Iff.class);
        sameFormula(iff.left(), provable(p));
        return provableIn(pq, iff.right());
    }

    public static Theorem iffRight(Theorem pq, Theorem q) {
        sameContext(pq, q);
        Iff iff = provable(pq, Iff.class);
        sameFormula(iff.right(), provable(q));
        return provableIn(pq, iff.left());
    }

    public static Theorem trueIntro(Context ctx) {
        return provableIn(ctx, new Top());
    }

    /**
     * @param p a formula-typing theorem for the conclusion
     */
    public static Theorem falseElim(Theorem f, Theorem p) {
        sameContext(f, p);
        provable(f, Bottom.class);
        return provableIn(f, hasType(p, Type.FORMULA));
    }

    /**
     * Reductio ad absurdum: from {@code ¬p → ⊥} conclude p.
     */
    public static Theorem raa(Theorem npf) {
        Implies implies = provable(npf, Implies.class);
        if (!(implies.left() instanceof Not not) || !(implies.right() instanceof Bottom)) {
            throw new KernelException(SHAPE_MISMATCH, "expected ¬p → ⊥", npf.judgment());
        }
        return provableIn(npf, not.formula());
    }

    public static Theorem eqIntro(Theorem t) {
        Expr term = hasType(t, Type.TERM);
        return provableIn(t, new Eq(term, term));
    }

    /**
     * From a = b and p(a) conclude p(b). The predicate p is given as a lambda, and the instance p(a)
     * must be syntactically {@code p} applied to a.
     *
     * @param lambda {@code λx. p} of type {@code Pred\1}
     */
    public static Theorem eqElim(Theorem lambda, Theorem ab, Theorem pa) {
        sameContext(lambda, ab, pa);
        Expr px = unaryPredicateBody(lambda);
        Eq eq = provable(ab, Eq.class);
        sameFormula(Substitution.makeReplace(eq.left(), px), provable(pa));
        return provableIn(ab, Substitution.makeReplace(eq.right(), px));
    }

    /**
     * Generalizes over the term variable in front of the context (context-changing).
     */
    public static Theorem forallIntro(Theorem p) {
        String x = frontTermDecl(p).name();
        Expr body = provable(p);
        return new Theorem(p.context().rest(), new Judgment.Provable(new Forall(x, Substitution.makeBound(x, body))));
    }

    public static Theorem forallElim(Theorem px, Theorem t) {
        sameContext(px, t);
        Forall forall = provable(px, Forall.class);
        return provableIn(px, Substitution.makeReplace(hasType(t, Type.TERM), forall.body()));
    }

    /**
     * @param formula either {@code ∃x. p} as a formula, or the predicate {@code λx. p}
     * @param t       the witness
     * @param pt      proof of p(t)
     */
    public static Theorem existsIntro(Theorem formula, Theorem t, Theorem pt) {
        sameContext(formula, t, pt);
        Exists exists = existential(formula);
        sameFormula(Substitution.makeReplace(hasType(t, Type.TERM), exists.body()), provable(pt));
        return provableIn(pt, exists);
    }

    /**
     * From {@code ∃x. p} and {@code ∀y. p(y) → q} conclude q, where q does not mention y.
     *
     * @param q a formula-typing theorem for the conclusion
     */
    public static Theorem existsElim(Theorem ex, Theorem all, Theorem q) {
        sameContext(ex, all, q);
        Exists exists = provable(ex, Exists.class);
        Forall forall = provable(all, Forall.class);
        if (!(forall.body() instanceof Implies implies)) {
            throw new KernelException(SHAPE_MISMATCH, "expected ∀y. p(y) → q", all.judgment());
        }
        sameFormula(exists.body(), implies.left());
        Expr conclusion = hasType(q, Type.FORMULA);
        sameFormula(conclusion, implies.right());
        return provableIn(ex, conclusion);
    }

    /**
     * From {@code ∃x. p} and {@code ∀x. p(x) → ∀y. p(y) → x = y} conclude {@code ∃!x. p}.
     */
    public static Theorem uniqueIntro(Theorem ex, Theorem one) {
        sameContext(ex, one);
        Exists exists = provable(ex, Exists.class);
        Expr px = exists.body();
        Expr form = provable(one);
        if (form instanceof Forall outer
                && outer.body() instanceof Implies outerImplies
                && outerImplies.right() instanceof Forall inner
                && inner.body() instanceof Implies innerImplies) {
            sameFormula(px, outerImplies.left());
            sameFormula(px, innerImplies.left());
            sameFormula(new Eq(Var.bound(1), Var.bound(0)), innerImplies.right());
            return provableIn(ex, new Unique(exists.name(), px));
        }
        throw new KernelException(SHAPE_MISMATCH, "expected ∀x. p(x) → ∀y. p(y) → x = y", one.judgment());
    }

    public static Theorem uniqueLeft(Theorem unique) {
        Unique u = provable(unique, Unique.class);
        return provableIn(unique, new Exists(u.name(), u.body()));
    }

    public static Theorem uniqueRight(Theorem unique) {
        Unique u = provable(unique, Unique.class);
        String y = Printer.freshName(u.name(), unique.context().names());
        // p only escapes through index 0, so it can be reused under the inner binder as p(y)
        Expr px = u.body();
        return provableIn(unique, new Forall(u.name(),
                new Implies(px, new Forall(y, new Implies(px, new Eq(Var.bound(1), Var.bound(0)))))));
    }

    /**
     * Generalizes over the function or predicate symbol in front of the context (context-changing).
     */
    public static Theorem forallFuncIntro(Theorem p) {
        FunctionType type = frontFuncType(p);
        String f = p.context().front().orElseThrow().name();
        Expr body = provable(p);
        return new Theorem(p.context().rest(), new Judgment.Provable(
                new ForallFunc(f, type.arity(), type.sort(), Substitution.makeBoundFunc(f, body))));
    }

    public static Theorem forallPredIntro(Theorem p) {
        if (frontFuncType(p).sort() != Sort.PROP) {
            throw new KernelException(SHAPE_MISMATCH, "expected a predicate in front of the context",
                    p.context().front().orElseThrow());
        }
        return forallFuncIntro(p);
    }

    /**
     * Instantiates a quantified function or predicate symbol with a lambda of the same type,
     * beta-reducing every application.
     */
    public static Theorem forallFuncElim(Theorem pf, Theorem f) {
        sameContext(pf, f);
        ForallFunc forall = provable(pf, ForallFunc.class);
        Judgment.HasType instance = functionTyped(f);
        if (!forall.type().equals(instance.type())) {
            throw new KernelException(SHAPE_MISMATCH,
                    "expected an instance of type " + forall.type() + ", got " + instance.type(), f.judgment());
        }
        return provableIn(pf, Substitution.makeReplaceFunc(instance.expr(), forall.body()));
    }

    public static Theorem forallPredElim(Theorem pp, Theorem p) {
        if (provable(pp, ForallFunc.class).sort() != Sort.PROP) {
            throw new KernelException(SHAPE_MISMATCH, "expected a quantified predicate", pp.judgment());
        }
        return forallFuncElim(pp, p);
    }

    private static Expr unaryPredicateBody(Theorem lambda) {
        if (hasType(lambda, new FunctionType(1, Sort.PROP)) instanceof Lam lam) {
            return lam.body();
        }
        throw new KernelException(SHAPE_MISMATCH, "expected a lambda", lambda.judgment());
    }

    private static Exists existential(Theorem formula) {
        if (formula.judgment() instanceof Judgment.HasType hasType && hasType.expr() instanceof Lam lam
                && hasType.type().equals(new FunctionType(1, Sort.PROP))) {
            return new Exists(lam.name(), lam.body());
        }
        Expr e = hasType(formula, Type.FORMULA);
        if (e instanceof Exists exists) {
            return exists;
        }
        throw new KernelException(SHAPE_MISMATCH, "expected ∃x. p or λx. p", formula.judgment());
    }

    private static Theorem provableIn(Theorem premise, Expr formula) {
        return provableIn(premise.context(), formula);
    }

    private static Theorem provableIn(Context ctx, Expr formula) {
        return new Theorem(ctx, new Judgment.Provable(formula));
    }
}
