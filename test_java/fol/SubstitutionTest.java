package fol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import fol.expr.And;
import fol.expr.Expr;
import fol.expr.Forall;
import fol.expr.Func;
import fol.expr.Lam;
import fol.expr.Not;
import fol.expr.Var;
import fol.expr.VarRef;
import java.util.List;
import org.junit.Test;

public class SubstitutionTest {

    private static Expr p(Expr arg) {
        return Func.free("P", List.of(arg));
    }

    private static Expr r(Expr left, Expr right) {
        return Func.free("R", List.of(left, right));
    }

    @Test
    public void binderNamesAreIgnoredByEquality() {
        Expr body = p(Var.bound(0));
        assertEquals(new Forall("x", body), new Forall("y", body));
        assertEquals(new Forall("x", body).hashCode(), new Forall("y", body).hashCode());
        assertEquals(new Lam("x", body), new Lam("y", body));
    }

    @Test
    public void freeNamesAreNotIgnored() {
        assertNotEquals(p(Var.free("x")), p(Var.free("y")));
    }

    @Test
    public void makeBoundUsesLocalDepth() {
        Expr e = new And(p(Var.free("x")), new Forall("y", r(Var.free("x"), Var.bound(0))));
        Expr expected = new And(p(Var.bound(0)), new Forall("y", r(Var.bound(1), Var.bound(0))));
        assertEquals(expected, Substitution.makeBound("x", e));
    }

    @Test
    public void makeFreeUndoesMakeBound() {
        Expr e = new And(p(Var.free("x")), new Forall("y", r(Var.free("x"), Var.bound(0))));
        assertEquals(e, Substitution.makeFree("x", Substitution.makeBound("x", e)));
    }

    @Test
    public void replaceVarReplacesOnlyTheGivenName() {
        Expr t = Func.free("f", List.of(Var.free("a")));
        Expr e = r(Var.free("x"), Var.free("z"));
        assertEquals(r(t, Var.free("z")), Substitution.replaceVar("x", t, e));
    }

    @Test
    public void makeReplaceSubstitutesEscapingIndex() {
        Expr t = Func.free("f", List.of(Var.free("a")));
        Expr body = new And(p(Var.bound(0)), new Forall("y", r(Var.bound(1), Var.bound(0))));
        Expr expected = new And(p(t), new Forall("y", r(t, Var.bound(0))));
        assertEquals(expected, Substitution.makeReplace(t, body));
    }

    @Test
    public void makeGapShiftsOnlyEscapingIndices() {
        Expr e = new Forall("y", r(Var.bound(1), Var.bound(0)));
        assertEquals(new Forall("y", r(Var.bound(3), Var.bound(0))), Substitution.makeGap(2, e));
        assertEquals(Var.bound(2), Substitution.makeGap(2, Var.bound(0)));
    }

    @Test
    public void makeReplaceAllUsesLeftmostArgumentForOutermostLambda() {
        // λx. λy. R(x, y)
        Expr body = r(Var.bound(1), Var.bound(0));
        Expr a = Var.free("a");
        Expr b = Var.free("b");
        assertEquals(r(a, b), Substitution.makeReplaceAll(List.of(a, b), body));
    }

    @Test
    public void makeReplaceAllShiftsOpenArguments() {
        // λx. ∀z. R(x, z) applied to an argument bound one level up
        Expr body = new Forall("z", r(Var.bound(1), Var.bound(0)));
        Expr result = Substitution.makeReplaceAll(List.of(Var.bound(0)), body);
        assertEquals(new Forall("z", r(Var.bound(1), Var.bound(0))), result);
    }

    @Test
    public void makeBoundFuncBindsFunctionHeads() {
        Expr e = new Forall("y", Func.free("F", List.of(Var.bound(0))));
        Expr expected = new Forall("y", new Func(VarRef.bound(1), List.of(Var.bound(0))));
        assertEquals(expected, Substitution.makeBoundFunc("F", e));
    }

    @Test
    public void makeReplaceFuncBetaReduces() {
        Expr c = Var.free("c");
        Expr q = new Func(VarRef.bound(0), List.of(c));
        Expr lambda = new Lam("x", new Not(p(Var.bound(0))));
        assertEquals(new Not(p(c)), Substitution.makeReplaceFunc(lambda, q));
    }

    @Test
    public void makeReplaceFuncUnderBinder() {
        Expr q = new Forall("y", new Func(VarRef.bound(1), List.of(Var.bound(0))));
        Expr lambda = new Lam("x", p(Var.bound(0)));
        assertEquals(new Forall("y", p(Var.bound(0))), Substitution.makeReplaceFunc(lambda, q));
    }

    @Test
    public void lambdaBodySkipsAllLambdas() {
        Expr body = r(Var.bound(1), Var.bound(0));
        assertEquals(body, Substitution.lambdaBody(new Lam("x", new Lam("y", body))));
    }
}
