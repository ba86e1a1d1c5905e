package proofChecking.elaborator;

import fol.expr.Expr;

/**
 * Derivation trees (proof terms). Embedded expressions are in surface syntax, see {@link ExprBuilder}.
 */
public sealed interface Proof {

    /**
     * A named theorem from the pool, or else a hypothesis in context.
     */
    record As(String name) implements Proof {
    }

    /**
     * A nested declaration; its last judgment is the proof's result.
     */
    record DeclProof(Decl decl) implements Proof {
    }

    record AndI(Proof p, Proof q) implements Proof {
    }

    record AndL(Proof pq) implements Proof {
    }

    record AndR(Proof pq) implements Proof {
    }

    record OrL(Proof p, Expr q) implements Proof {
    }

    record OrR(Expr p, Proof q) implements Proof {
    }

    record OrE(Proof pq, Proof pr, Proof qr) implements Proof {
    }

    record ImpliesE(Proof pq, Proof p) implements Proof {
    }

    record NotI(Proof pf) implements Proof {
    }

    record NotE(Proof np, Proof p) implements Proof {
    }

    record IffI(Proof pq, Proof qp) implements Proof {
    }

    record IffL(Proof pq, Proof p) implements Proof {
    }

    record IffR(Proof pq, Proof q) implements Proof {
    }

    record TrueI() implements Proof {
    }

    record FalseE(Proof f, Expr p) implements Proof {
    }

    record Raa(Proof npf) implements Proof {
    }

    record EqI(Expr t) implements Proof {
    }

    /**
     * @param p the predicate, as a lambda
     */
    record EqE(Expr p, Proof ab, Proof pa) implements Proof {
    }

    record ForallE(Proof px, Expr t) implements Proof {
    }

    /**
     * @param p the existential formula (or the predicate as a lambda)
     */
    record ExistsI(Expr p, Expr t, Proof pt) implements Proof {
    }

    record ExistsE(Proof ex, Proof all, Expr q) implements Proof {
    }

    record UniqueI(Proof ex, Proof one) implements Proof {
    }

    record UniqueL(Proof unique) implements Proof {
    }

    record UniqueR(Proof unique) implements Proof {
    }

    record ForallFuncE(Proof pf, Expr f) implements Proof {
    }

    record ForallPredE(Proof pp, Expr p) implements Proof {
    }
}
