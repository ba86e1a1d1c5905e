package proofChecking.elaborator;

import fol.expr.Expr;
import java.util.List;
import java.util.Optional;

/**
 * Declarations of a proof script. Scoped declarations introduce a context entry for their body and
 * generalize everything asserted inside it when the scope closes.
 */
public sealed interface Decl {

    record Block(List<Decl> decls) implements Decl {
        public Block {
            decls = List.copyOf(decls);
        }

        public static Block of(Decl... decls) {
            return new Block(List.of(decls));
        }
    }

    /**
     * @param expected the statement, if given, must equal the proved formula
     */
    record Assertion(String name, Optional<Expr> expected, Proof proof) implements Decl {
        public Assertion(String name, Proof proof) {
            this(name, Optional.empty(), proof);
        }
    }

    record Any(String name, Decl body) implements Decl {
    }

    record AnyFunc(String name, int arity, Decl body) implements Decl {
    }

    record AnyPred(String name, int arity, Decl body) implements Decl {
    }

    record Assume(String name, Expr formula, Decl body) implements Decl {
    }
}
