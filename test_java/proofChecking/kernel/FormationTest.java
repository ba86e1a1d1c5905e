package proofChecking.kernel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import fol.expr.Eq;
import fol.expr.Forall;
import fol.expr.ForallFunc;
import fol.expr.Func;
import fol.expr.Lam;
import fol.expr.SchemaApp;
import fol.expr.Var;
import fol.expr.VarRef;
import fol.type.FunctionType;
import fol.type.Sort;
import fol.type.Type;
import java.util.List;
import org.junit.Test;

public class FormationTest {

    private static final Context PX = Context.empty().extendFunc("P", 1, Sort.PROP).extendVar("x");

    private static Theorem px() {
        return Formation.funcMk(PX, "P", List.of(Formation.varMk(PX, "x")));
    }

    @Test
    public void varMkLooksUpTermVariables() {
        assertEquals(new Judgment.HasType(Var.free("x"), Type.TERM), Formation.varMk(PX, "x").judgment());
        assertEquals(KernelException.Reason.UNBOUND_NAME,
                assertThrows(KernelException.class, () -> Formation.varMk(PX, "y")).reason());
        assertEquals(KernelException.Reason.SHAPE_MISMATCH,
                assertThrows(KernelException.class, () -> Formation.varMk(PX, "P")).reason());
    }

    @Test
    public void funcMkChecksArity() {
        KernelException e = assertThrows(KernelException.class, () -> Formation.funcMk(PX, "P", List.of()));
        assertEquals(KernelException.Reason.ARITY_MISMATCH, e.reason());
    }

    @Test
    public void funcMkChecksArgumentContexts() {
        Context other = PX.extendVar("y");
        Theorem y = Formation.varMk(other, "y");
        KernelException e = assertThrows(KernelException.class, () -> Formation.funcMk(PX, "P", List.of(y)));
        assertEquals(KernelException.Reason.CONTEXT_MISMATCH, e.reason());
    }

    @Test
    public void funcMkAppliesPredicate() {
        assertEquals(new Judgment.HasType(Func.free("P", List.of(Var.free("x"))), Type.FORMULA),
                px().judgment());
    }

    @Test
    public void eqMkRequiresSameContext() {
        Theorem x = Formation.varMk(PX, "x");
        Theorem y = Formation.varMk(PX.extendVar("y"), "y");
        KernelException e = assertThrows(KernelException.class, () -> Formation.eqMk(x, y));
        assertEquals(KernelException.Reason.CONTEXT_MISMATCH, e.reason());
        assertEquals(new Eq(Var.free("x"), Var.free("x")),
                ((Judgment.HasType) Formation.eqMk(x, x).judgment()).expr());
    }

    @Test
    public void connectivesRequireFormulas() {
        Theorem x = Formation.varMk(PX, "x");
        KernelException e = assertThrows(KernelException.class, () -> Formation.andMk(px(), x));
        assertEquals(KernelException.Reason.SHAPE_MISMATCH, e.reason());
    }

    @Test
    public void forallMkBindsFrontVariable() {
        Theorem thm = Formation.forallMk(px());
        assertEquals(Context.empty().extendFunc("P", 1, Sort.PROP), thm.context());
        assertEquals(new Judgment.HasType(
                new Forall("x", Func.free("P", List.of(Var.bound(0)))), Type.FORMULA), thm.judgment());
    }

    @Test
    public void forallMkNeedsTermVariableInFront() {
        Context ctx = PX.extendFunc("Q", 0, Sort.PROP);
        Theorem q = Formation.funcMk(ctx, "Q", List.of());
        KernelException e = assertThrows(KernelException.class, () -> Formation.forallMk(q));
        assertEquals(KernelException.Reason.SHAPE_MISMATCH, e.reason());
    }

    @Test
    public void lamMkRaisesArity() {
        Theorem thm = Formation.lamMk(px());
        assertEquals(new Judgment.HasType(
                new Lam("x", Func.free("P", List.of(Var.bound(0)))), new FunctionType(1, Sort.PROP)),
                thm.judgment());
    }

    @Test
    public void forallFuncMkBindsFunctionHeads() {
        Context ctx = Context.empty().extendVar("a").extendFunc("P", 1, Sort.PROP);
        Theorem pa = Formation.funcMk(ctx, "P", List.of(Formation.varMk(ctx, "a")));
        Theorem thm = Formation.forallFuncMk(pa);
        assertEquals(Context.empty().extendVar("a"), thm.context());
        assertEquals(new Judgment.HasType(new ForallFunc("P", 1, Sort.PROP,
                new Func(VarRef.bound(0), List.of(Var.free("a")))), Type.FORMULA), thm.judgment());
    }

    @Test
    public void forallFuncMkRejectsTermVariables() {
        Context ctx = Context.empty().extendFunc("P", 1, Sort.PROP).extendFunc("a", 0, Sort.TERM);
        Theorem pa = Formation.funcMk(ctx, "P", List.of(Formation.varMk(ctx, "a")));
        KernelException e = assertThrows(KernelException.class, () -> Formation.forallFuncMk(pa));
        assertEquals(KernelException.Reason.SHAPE_MISMATCH, e.reason());
    }

    @Test
    public void schemaMkAppliesToMatchingPredicate() {
        Context ctx = Context.empty().extendSchema("S", 1, Sort.PROP, 0, Sort.PROP).extendFunc("P", 1, Sort.PROP);
        Context inner = ctx.extendVar("x");
        Theorem lambda = Formation.lamMk(Formation.funcMk(inner, "P", List.of(Formation.varMk(inner, "x"))));
        Theorem thm = Formation.schemaMk("S", lambda);
        assertEquals(ctx, thm.context());
        assertEquals(new Judgment.HasType(new SchemaApp(VarRef.free("S"),
                new Lam("x", Func.free("P", List.of(Var.bound(0))))), Type.FORMULA), thm.judgment());

        Theorem x = Formation.varMk(PX, "x");
        assertEquals(KernelException.Reason.UNBOUND_NAME,
                assertThrows(KernelException.class, () -> Formation.schemaMk("S", x)).reason());
    }

    @Test
    public void schemaMkChecksArgumentType() {
        Context ctx = Context.empty().extendSchema("S", 1, Sort.PROP, 0, Sort.PROP).extendVar("x");
        Theorem x = Formation.varMk(ctx, "x");
        KernelException e = assertThrows(KernelException.class, () -> Formation.schemaMk("S", x));
        assertEquals(KernelException.Reason.SHAPE_MISMATCH, e.reason());
    }
}
