package proofChecking;

import static proofChecking.elaborator.ExprBuilder.pred;
import static proofChecking.elaborator.ExprBuilder.var;

import fol.expr.And;
import fol.expr.Bottom;
import fol.expr.Eq;
import fol.expr.Exists;
import fol.expr.Expr;
import fol.expr.Forall;
import fol.expr.Implies;
import fol.expr.Not;
import java.util.Optional;
import proofChecking.elaborator.Decl;
import proofChecking.elaborator.Decl.Any;
import proofChecking.elaborator.Decl.AnyPred;
import proofChecking.elaborator.Decl.Assertion;
import proofChecking.elaborator.Decl.Assume;
import proofChecking.elaborator.Decl.Block;
import proofChecking.elaborator.Proof.AndL;
import proofChecking.elaborator.Proof.AndR;
import proofChecking.elaborator.Proof.As;
import proofChecking.elaborator.Proof.ExistsE;
import proofChecking.elaborator.Proof.ForallE;
import proofChecking.elaborator.Proof.ImpliesE;
import proofChecking.elaborator.Proof.NotE;
import proofChecking.elaborator.Proof.NotI;

/**
 * Sample proof scripts.
 */
public class Scripts {

    /** ∀x ∀y, L(x, y) → ∀z, z ≠ y → ¬L(x, z) */
    public static final Expr H1 = new Forall("x", new Forall("y", new Implies(
            pred("L", var("x"), var("y")),
            new Forall("z", new Implies(
                    new Not(new Eq(var("z"), var("y"))),
                    new Not(pred("L", var("x"), var("z"))))))));

    /** ∀x ∀y ∀z, B(x, y, z) → L(x, z) → L(x, y) */
    public static final Expr H2 = new Forall("x", new Forall("y", new Forall("z", new Implies(
            pred("B", var("x"), var("y"), var("z")),
            new Implies(pred("L", var("x"), var("z")), pred("L", var("x"), var("y")))))));

    /** ∃x, x ≠ Q ∧ ∀y, B(y, x, Q) */
    public static final Expr H3 = new Exists("x", new And(
            new Not(new Eq(var("x"), var("Q"))),
            new Forall("y", pred("B", var("y"), var("x"), var("Q")))));

    /** ¬∃x, L(x, Q) */
    public static final Expr GOAL = new Not(new Exists("x", pred("L", var("x"), var("Q"))));

    /**
     * Derives {@link #GOAL} from the three hypotheses h1, h2, h3, which must be in context.
     */
    public static final Decl GOAL_PROOF = Block.of(
            new Any("c", new Assume("hc", new And(
                    new Not(new Eq(var("c"), var("Q"))),
                    new Forall("x", pred("B", var("x"), var("c"), var("Q")))), Block.of(
                    new Assertion("hc1", new AndL(new As("hc"))),
                    new Assertion("hc2", new AndR(new As("hc"))),
                    new Assume("hex", new Exists("x", pred("L", var("x"), var("Q"))), Block.of(
                            new Any("x", new Assume("hx", pred("L", var("x"), var("Q")), Block.of(
                                    new Assertion("t1", new ImpliesE(
                                            new ForallE(new ForallE(new As("h1"), var("x")), var("Q")),
                                            new As("hx"))),
                                    new Assertion("t2", new ImpliesE(
                                            new ForallE(new As("t1"), var("c")),
                                            new As("hc1"))),
                                    new Assertion("t3", new ForallE(new As("hc2"), var("x"))),
                                    new Assertion("t4", new ImpliesE(new ImpliesE(
                                            new ForallE(new ForallE(new ForallE(new As("h2"), var("x")), var("c")),
                                                    var("Q")),
                                            new As("t3")), new As("hx"))),
                                    new Assertion("t5", new NotE(new As("t2"), new As("t4")))))),
                            new Assertion("t6", new ExistsE(new As("hex"), new As("t5"), new Bottom())))),
                    new Assertion("t7", new NotI(new As("t6")))))),
            new Assertion("t8", Optional.of(GOAL),
                    new ExistsE(new As("h3"), new As("t7"), GOAL)));

    /**
     * The whole script: declares L, B and Q, assumes h1, h2, h3 and proves {@link #GOAL}.
     */
    public static final Decl EXAMPLE =
            new AnyPred("L", 2, new AnyPred("B", 3, new Any("Q",
                    new Assume("h1", H1, new Assume("h2", H2, new Assume("h3", H3, GOAL_PROOF))))));

    private Scripts() {
    }
}
