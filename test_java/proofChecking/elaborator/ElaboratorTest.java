package proofChecking.elaborator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static proofChecking.elaborator.ExprBuilder.pred;
import static proofChecking.elaborator.ExprBuilder.var;

import fol.expr.Bottom;
import fol.expr.Eq;
import fol.expr.Expr;
import fol.expr.Forall;
import fol.expr.ForallFunc;
import fol.expr.Implies;
import fol.expr.Lam;
import fol.expr.Var;
import fol.type.Sort;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.Test;
import proofChecking.Scripts;
import proofChecking.elaborator.Decl.Any;
import proofChecking.elaborator.Decl.AnyPred;
import proofChecking.elaborator.Decl.Assertion;
import proofChecking.elaborator.Decl.Assume;
import proofChecking.elaborator.Decl.Block;
import proofChecking.elaborator.Proof.AndL;
import proofChecking.elaborator.Proof.As;
import proofChecking.elaborator.Proof.EqI;
import proofChecking.elaborator.Proof.ForallPredE;
import proofChecking.elaborator.Proof.TrueI;
import proofChecking.kernel.Context;
import proofChecking.kernel.Judgment;
import proofChecking.kernel.KernelException.Reason;
import proofChecking.kernel.Theorem;

public class ElaboratorTest {

    private static Judgment provable(Context ctx, Expr surface) {
        return new Judgment.Provable(((Judgment.HasType) ExprBuilder.convert(ctx, surface).judgment()).expr());
    }

    private static Context withHypotheses() {
        Context ctx = Context.empty()
                .extendFunc("L", 2, Sort.PROP)
                .extendFunc("B", 3, Sort.PROP)
                .extendVar("Q");
        ctx = ctx.extendHyp("h1", ExprBuilder.convert(ctx, Scripts.H1));
        ctx = ctx.extendHyp("h2", ExprBuilder.convert(ctx, Scripts.H2));
        return ctx.extendHyp("h3", ExprBuilder.convert(ctx, Scripts.H3));
    }

    @Test
    public void provesGoalFromHypotheses() {
        Context ctx = withHypotheses();
        Elaborator elaborator = new Elaborator();
        Theorem thm = elaborator.checkDecl(ctx, Scripts.GOAL_PROOF);

        assertEquals(ctx, thm.context());
        assertEquals(provable(ctx, Scripts.GOAL), thm.judgment());
        assertEquals(thm, elaborator.getPool().lookup("t8").orElseThrow());
        assertEquals(1, elaborator.getPool().depth());
    }

    @Test
    public void closedScopesGeneralizeTheWholeScript() {
        Elaborator elaborator = new Elaborator();
        Theorem thm = elaborator.check(Scripts.EXAMPLE);

        Expr statement = new ForallFunc("L", 2, Sort.PROP, new ForallFunc("B", 3, Sort.PROP, new Forall("Q",
                new Implies(Scripts.H1, new Implies(Scripts.H2, new Implies(Scripts.H3, Scripts.GOAL))))));
        assertEquals(Context.empty(), thm.context());
        assertEquals(provable(Context.empty(), statement), thm.judgment());
        assertEquals(thm, elaborator.getPool().lookup("t8").orElseThrow());
        assertTrue(elaborator.getPool().lookup("t5").orElseThrow().context().isEmpty());
    }

    @Test
    public void variableScopeGeneralizesPooledTheorems() {
        Elaborator elaborator = new Elaborator();
        elaborator.check(new Any("x", new Assertion("refl", new EqI(var("x")))));
        Theorem refl = elaborator.getPool().lookup("refl").orElseThrow();
        assertEquals(new Judgment.Provable(new Forall("x", new Eq(Var.bound(0), Var.bound(0)))), refl.judgment());
    }

    @Test
    public void instantiatesQuantifiedPredicate() {
        Expr aa = new Eq(var("a"), var("a"));
        Decl script = Block.of(
                new AnyPred("R", 1, new Any("a", new Assume("h", pred("R", var("a")),
                        new Assertion("id", new As("h"))))),
                new Assertion("inst",
                        Optional.of(new Forall("a", new Implies(aa, aa))),
                        new ForallPredE(new As("id"), new Lam("x", new Eq(var("x"), var("x"))))));
        Theorem thm = new Elaborator().check(script);
        assertEquals(new Judgment.Provable(new Forall("a", new Implies(
                new Eq(Var.bound(0), Var.bound(0)), new Eq(Var.bound(0), Var.bound(0))))), thm.judgment());
    }

    @Test
    public void emptyBlockIsRejected() {
        Block empty = Block.of();
        ElaborationException e = assertThrows(ElaborationException.class, () -> new Elaborator().check(empty));
        assertEquals(Reason.EMPTY_BLOCK, e.reason());
        assertEquals(empty, e.node());
    }

    @Test
    public void statementMustMatchProof() {
        Assertion assertion = new Assertion("t", Optional.of(new Bottom()), new TrueI());
        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator().check(new Any("x", assertion)));
        assertEquals(Reason.FORMULA_MISMATCH, e.reason());
        assertEquals(assertion, e.node());
    }

    @Test
    public void unknownNameIsReportedAtItsReference() {
        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator().check(new Assertion("t", new As("nope"))));
        assertEquals(Reason.UNBOUND_NAME, e.reason());
        assertEquals(new As("nope"), e.node());
    }

    @Test
    public void kernelFailureIsReportedAtInnermostNode() {
        AndL step = new AndL(new TrueI());
        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator().check(new Assertion("t", step)));
        assertEquals(Reason.SHAPE_MISMATCH, e.reason());
        assertEquals(step, e.node());
    }

    @Test
    public void hypothesisMustBeFormula() {
        Assume assume = new Assume("h", var("x"), new Assertion("t", new TrueI()));
        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator().check(new Any("x", assume)));
        assertEquals(Reason.SHAPE_MISMATCH, e.reason());
        assertEquals(assume, e.node());
    }

    @Test
    public void failedScopeIsDroppedFromPool() {
        Elaborator elaborator = new Elaborator();
        Decl script = Block.of(
                new Assertion("top", new TrueI()),
                new Any("x", Block.of(
                        new Assertion("r", new EqI(var("x"))),
                        new Assertion("bad", new As("nope")))));
        ElaborationException e = assertThrows(ElaborationException.class, () -> elaborator.check(script));
        assertEquals(Reason.UNBOUND_NAME, e.reason());

        TheoremPool pool = elaborator.getPool();
        assertEquals(1, pool.depth());
        assertTrue(pool.lookup("top").isPresent());
        assertFalse(pool.lookup("r").isPresent());

        elaborator.check(new Any("x", new Assertion("r", new EqI(var("x")))));
        assertEquals(new Judgment.Provable(new Forall("x", new Eq(Var.bound(0), Var.bound(0)))),
                pool.lookup("r").orElseThrow().judgment());
    }

    @Test
    public void scopeCannotRedeclareName() {
        Any inner = new Any("x", new Assertion("t", new TrueI()));
        ElaborationException e = assertThrows(ElaborationException.class,
                () -> new Elaborator().check(new Any("x", inner)));
        assertEquals(Reason.DUPLICATE_NAME, e.reason());
        assertEquals(inner, e.node());
    }

    @Test
    public void traceListsAssertions() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Elaborator elaborator = new Elaborator();
        elaborator.setTrace(new PrintStream(out, true, StandardCharsets.UTF_8));
        elaborator.check(Scripts.EXAMPLE);

        String trace = out.toString(StandardCharsets.UTF_8);
        assertTrue(trace.contains("* t1: "));
        assertTrue(trace.contains("* t8: "));
        assertTrue(trace.contains("generalized over L"));
    }
}
