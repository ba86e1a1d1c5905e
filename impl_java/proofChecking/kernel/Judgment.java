package proofChecking.kernel;

import fol.Printer;
import fol.expr.Expr;
import fol.type.Type;
import java.util.Collection;
import java.util.List;

public sealed interface Judgment permits Judgment.HasType, Judgment.Provable {

    String show(Collection<String> used);

    record HasType(Expr expr, Type type) implements Judgment {
        @Override
        public String show(Collection<String> used) {
            return Printer.show(expr, used) + " : " + type;
        }

        @Override
        public String toString() {
            return show(List.of());
        }
    }

    record Provable(Expr formula) implements Judgment {
        @Override
        public String show(Collection<String> used) {
            return Printer.show(formula, used);
        }

        @Override
        public String toString() {
            return show(List.of());
        }
    }
}
