package proofChecking.elaborator;

import fol.expr.Expr;
import fol.type.FunctionType;
import fol.type.Sort;
import fol.type.Type;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import proofChecking.kernel.Context;
import proofChecking.kernel.Deduction;
import proofChecking.kernel.Formation;
import proofChecking.kernel.Judgment;
import proofChecking.kernel.KernelException;
import proofChecking.kernel.KernelException.Reason;
import proofChecking.kernel.Theorem;

/**
 * Checks proof scripts against the kernel.
 * <p>
 * Declarations are checked left to right, depth first. Every assertion is added to the innermost scope of the
 * {@link TheoremPool}; when a scope closes, all of its theorems are generalized over the scope's variable or
 * hypothesis and moved to the enclosing scope. The first failure aborts the whole run; every scope opened by
 * the failed declaration is dropped from the pool.
 */
public class Elaborator {

    private enum ScopeKind {
        VAR, FUNC, PRED, HYP
    }

    private final TheoremPool pool;
    private PrintStream trace;

    public Elaborator() {
        this(new TheoremPool());
    }

    public Elaborator(TheoremPool pool) {
        this.pool = pool;
    }

    /**
     * Writes a line for each registered assertion and closed scope to {@code trace}; {@code null} disables it.
     */
    public void setTrace(PrintStream trace) {
        this.trace = trace;
    }

    public TheoremPool getPool() {
        return pool;
    }

    public Theorem check(Decl decl) {
        return checkDecl(Context.empty(), decl);
    }

    /**
     * Checks a declaration; returns the judgment for the last declaration.
     */
    public Theorem checkDecl(Context ctx, Decl decl) {
        if (decl instanceof Decl.Block block) {
            if (block.decls().isEmpty()) {
                throw new ElaborationException(Reason.EMPTY_BLOCK, "empty block", block);
            }
            Theorem last = null;
            for (Decl d : block.decls()) {
                last = checkDecl(ctx, d);
            }
            return last;
        } else if (decl instanceof Decl.Assertion assertion) {
            return checkAssertion(ctx, assertion);
        } else if (decl instanceof Decl.Any any) {
            Context inner = attribute(() -> ctx.extendVar(any.name()), any);
            return checkScope(ScopeKind.VAR, inner, any.body(), any);
        } else if (decl instanceof Decl.AnyFunc anyFunc) {
            Context inner = attribute(() -> ctx.extendFunc(anyFunc.name(), anyFunc.arity(), Sort.TERM), anyFunc);
            return checkScope(ScopeKind.FUNC, inner, anyFunc.body(), anyFunc);
        } else if (decl instanceof Decl.AnyPred anyPred) {
            Context inner = attribute(() -> ctx.extendFunc(anyPred.name(), anyPred.arity(), Sort.PROP), anyPred);
            return checkScope(ScopeKind.PRED, inner, anyPred.body(), anyPred);
        } else if (decl instanceof Decl.Assume assume) {
            Context inner = attribute(
                    () -> ctx.extendHyp(assume.name(), ExprBuilder.convert(ctx, assume.formula())), assume);
            return checkScope(ScopeKind.HYP, inner, assume.body(), assume);
        }
        throw new IllegalStateException("Unexpected declaration type: " + decl.getClass());
    }

    /**
     * Checks a proof; returns its judgment in {@code ctx}.
     */
    public Theorem checkProof(Context ctx, Proof proof) {
        try {
            return applyRule(ctx, proof);
        } catch (KernelException e) {
            throw new ElaborationException(proof, e);
        }
    }

    private Theorem applyRule(Context ctx, Proof proof) {
        if (proof instanceof Proof.As as) {
            var pooled = pool.lookup(as.name());
            if (pooled.isPresent()) {
                return pooled.get().weaken(ctx);
            }
            // Not a named theorem: cite the hypothesis directly
            return Deduction.assumption(ctx, as.name());
        } else if (proof instanceof Proof.DeclProof declProof) {
            return checkDecl(ctx, declProof.decl());
        } else if (proof instanceof Proof.AndI p) {
            return Deduction.andIntro(checkProof(ctx, p.p()), checkProof(ctx, p.q()));
        } else if (proof instanceof Proof.AndL p) {
            return Deduction.andLeft(checkProof(ctx, p.pq()));
        } else if (proof instanceof Proof.AndR p) {
            return Deduction.andRight(checkProof(ctx, p.pq()));
        } else if (proof instanceof Proof.OrL p) {
            return Deduction.orLeft(checkProof(ctx, p.p()), ExprBuilder.convert(ctx, p.q()));
        } else if (proof instanceof Proof.OrR p) {
            return Deduction.orRight(ExprBuilder.convert(ctx, p.p()), checkProof(ctx, p.q()));
        } else if (proof instanceof Proof.OrE p) {
            return Deduction.orElim(checkProof(ctx, p.pq()), checkProof(ctx, p.pr()), checkProof(ctx, p.qr()));
        } else if (proof instanceof Proof.ImpliesE p) {
            return Deduction.impliesElim(checkProof(ctx, p.pq()), checkProof(ctx, p.p()));
        } else if (proof instanceof Proof.NotI p) {
            return Deduction.notIntro(checkProof(ctx, p.pf()));
        } else if (proof instanceof Proof.NotE p) {
            return Deduction.notElim(checkProof(ctx, p.np()), checkProof(ctx, p.p()));
        } else if (proof instanceof Proof.IffI p) {
            return Deduction.iffIntro(checkProof(ctx, p.pq()), checkProof(ctx, p.qp()));
        } else if (proof instanceof Proof.IffL p) {
            return Deduction.iffLeft(checkProof(ctx, p.pq()), checkProof(ctx, p.p()));
        } else if (proof instanceof Proof.IffR p) {
            return Deduction.iffRight(checkProof(ctx, p.pq()), checkProof(ctx, p.q()));
        } else if (proof instanceof Proof.TrueI) {
            return Deduction.trueIntro(ctx);
        } else if (proof instanceof Proof.FalseE p) {
            return Deduction.falseElim(checkProof(ctx, p.f()), ExprBuilder.convert(ctx, p.p()));
        } else if (proof instanceof Proof.Raa p) {
            return Deduction.raa(checkProof(ctx, p.npf()));
        } else if (proof instanceof Proof.EqI p) {
            return Deduction.eqIntro(ExprBuilder.convert(ctx, p.t()));
        } else if (proof instanceof Proof.EqE p) {
            Theorem lambda = ExprBuilder.convert(ctx, p.p());
            return Deduction.eqElim(lambda, checkProof(ctx, p.ab()), checkProof(ctx, p.pa()));
        } else if (proof instanceof Proof.ForallE p) {
            return Deduction.forallElim(checkProof(ctx, p.px()), ExprBuilder.convert(ctx, p.t()));
        } else if (proof instanceof Proof.ExistsI p) {
            Theorem formula = ExprBuilder.convert(ctx, p.p());
            Theorem witness = ExprBuilder.convert(ctx, p.t());
            return Deduction.existsIntro(formula, witness, checkProof(ctx, p.pt()));
        } else if (proof instanceof Proof.ExistsE p) {
            Theorem ex = checkProof(ctx, p.ex());
            Theorem all = checkProof(ctx, p.all());
            return Deduction.existsElim(ex, all, ExprBuilder.convert(ctx, p.q()));
        } else if (proof instanceof Proof.UniqueI p) {
            return Deduction.uniqueIntro(checkProof(ctx, p.ex()), checkProof(ctx, p.one()));
        } else if (proof instanceof Proof.UniqueL p) {
            return Deduction.uniqueLeft(checkProof(ctx, p.unique()));
        } else if (proof instanceof Proof.UniqueR p) {
            return Deduction.uniqueRight(checkProof(ctx, p.unique()));
        } else if (proof instanceof Proof.ForallFuncE p) {
            return Deduction.forallFuncElim(checkProof(ctx, p.pf()), ExprBuilder.convert(ctx, p.f()));
        } else if (proof instanceof Proof.ForallPredE p) {
            return Deduction.forallPredElim(checkProof(ctx, p.pp()), ExprBuilder.convert(ctx, p.p()));
        }
        throw new IllegalStateException("Unexpected proof type: " + proof.getClass());
    }

    private Theorem checkAssertion(Context ctx, Decl.Assertion assertion) {
        Theorem thm = checkProof(ctx, assertion.proof());
        if (!(thm.judgment() instanceof Judgment.Provable provable)) {
            throw new ElaborationException(Reason.SHAPE_MISMATCH, "proof does not prove a formula", assertion);
        }
        if (assertion.expected().isPresent()) {
            Expr expected = attribute(
                    () -> formula(ExprBuilder.convert(ctx, assertion.expected().get())), assertion);
            if (!expected.equals(provable.formula())) {
                throw new ElaborationException(Reason.FORMULA_MISMATCH,
                        "statement " + expected + " and proof of " + provable.formula() + " do not match",
                        assertion);
            }
        }
        pool.addTheorem(assertion.name(), thm);
        trace(pool.depth() - 1, assertion.name() + ": " + provable.show(ctx.names()));
        return thm;
    }

    /**
     * Checks the body of a scoped declaration in a new pool scope. On failure the scope is dropped, so the
     * pool is left as it was before the declaration.
     */
    private Theorem checkScope(ScopeKind kind, Context inner, Decl body, Decl scope) {
        pool.push();
        Theorem result;
        try {
            result = checkDecl(inner, body);
        } catch (RuntimeException e) {
            pool.pop();
            throw e;
        }
        return closeScope(kind, result, scope);
    }

    /**
     * Pops the innermost scope, generalizing each of its theorems into the enclosing scope, and generalizes
     * the scope's result the same way. Nothing is added to the enclosing scope unless every theorem
     * generalizes.
     */
    private Theorem closeScope(ScopeKind kind, Theorem result, Decl scope) {
        Map<String, Theorem> table = pool.pop();
        Map<String, Theorem> generalized = new LinkedHashMap<>();
        for (var entry : table.entrySet()) {
            generalized.put(entry.getKey(), generalize(kind, entry.getValue(), scope));
        }
        Theorem thm = generalize(kind, result, scope);
        generalized.forEach(pool::addTheorem);
        trace(pool.depth() - 1, "(" + table.size() + " generalized over " + scopeName(scope) + ")");
        return thm;
    }

    private Theorem generalize(ScopeKind kind, Theorem thm, Decl scope) {
        Judgment judgment = thm.judgment();
        try {
            if (judgment instanceof Judgment.Provable) {
                switch (kind) {
                    case VAR:
                        return Deduction.forallIntro(thm);
                    case FUNC:
                        return Deduction.forallFuncIntro(thm);
                    case PRED:
                        return Deduction.forallPredIntro(thm);
                    case HYP:
                        return Deduction.impliesIntro(thm);
                    default:
                        throw new IllegalStateException("Unexpected scope kind: " + kind);
                }
            }
            if (kind == ScopeKind.VAR && judgment instanceof Judgment.HasType hasType
                    && hasType.type() instanceof FunctionType) {
                return Formation.lamMk(thm);
            }
        } catch (KernelException e) {
            throw new ElaborationException(scope, e);
        }
        // TODO: second-order functions/predicates, and partial functions under hypotheses
        throw new ElaborationException(Reason.UNSUPPORTED,
                "cannot generalize " + judgment + " over " + scopeName(scope), scope);
    }

    private static String scopeName(Decl scope) {
        if (scope instanceof Decl.Any any) return any.name();
        if (scope instanceof Decl.AnyFunc anyFunc) return anyFunc.name();
        if (scope instanceof Decl.AnyPred anyPred) return anyPred.name();
        if (scope instanceof Decl.Assume assume) return assume.name();
        return scope.toString();
    }

    private static Expr formula(Theorem thm) {
        if (thm.judgment() instanceof Judgment.HasType hasType && hasType.type().equals(Type.FORMULA)) {
            return hasType.expr();
        }
        throw new KernelException(Reason.SHAPE_MISMATCH, "expected a formula", thm.judgment());
    }

    /**
     * Runs a kernel step on behalf of a declaration, attributing its failure to the declaration.
     */
    private static <T> T attribute(KernelStep<T> step, Decl decl) {
        try {
            return step.run();
        } catch (KernelException e) {
            throw new ElaborationException(decl, e);
        }
    }

    @FunctionalInterface
    private interface KernelStep<T> {
        T run();
    }

    private void trace(int indentation, String line) {
        if (trace == null) return;
        trace.println("  ".repeat(Math.max(0, indentation)) + "* " + line);
    }
}
