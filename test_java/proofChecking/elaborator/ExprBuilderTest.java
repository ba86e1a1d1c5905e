package proofChecking.elaborator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static proofChecking.elaborator.ExprBuilder.pred;
import static proofChecking.elaborator.ExprBuilder.var;

import fol.expr.And;
import fol.expr.Eq;
import fol.expr.Expr;
import fol.expr.Forall;
import fol.expr.Implies;
import fol.expr.Var;
import fol.type.Sort;
import fol.type.Type;
import org.junit.Test;
import proofChecking.kernel.Context;
import proofChecking.kernel.Judgment;
import proofChecking.kernel.KernelException;

public class ExprBuilderTest {

    private static final Context CTX = Context.empty().extendVar("x").extendFunc("P", 1, Sort.PROP);

    private static Expr formula(Context ctx, Expr surface) {
        Judgment.HasType hasType = (Judgment.HasType) ExprBuilder.convert(ctx, surface).judgment();
        assertEquals(Type.FORMULA, hasType.type());
        return hasType.expr();
    }

    @Test
    public void binderMayReuseDeclaredName() {
        Expr e = formula(CTX, new And(pred("P", var("x")), new Forall("x", pred("P", var("x")))));
        assertEquals(new And(pred("P", var("x")), new Forall("x", pred("P", Var.bound(0)))), e);
    }

    @Test
    public void innerBinderShadowsOuterOne() {
        Expr e = formula(CTX, new Forall("x", new Implies(pred("P", var("x")),
                new Forall("y", new Forall("x", new Eq(var("x"), var("y")))))));
        Expr expected = new Forall("x", new Implies(pred("P", Var.bound(0)),
                new Forall("y", new Forall("x", new Eq(Var.bound(0), Var.bound(1))))));
        assertEquals(expected, e);
    }

    @Test
    public void unknownNameIsRejected() {
        KernelException e = assertThrows(KernelException.class,
                () -> ExprBuilder.convert(CTX, pred("P", var("z"))));
        assertEquals(KernelException.Reason.UNBOUND_NAME, e.reason());
    }

    @Test
    public void boundIndicesAreRejected() {
        KernelException e = assertThrows(KernelException.class,
                () -> ExprBuilder.convert(CTX, pred("P", Var.bound(0))));
        assertEquals(KernelException.Reason.SHAPE_MISMATCH, e.reason());
    }
}
