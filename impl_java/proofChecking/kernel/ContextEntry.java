package proofChecking.kernel;

import fol.Printer;
import fol.expr.Expr;
import fol.type.Type;

public sealed interface ContextEntry permits ContextEntry.VarDecl, ContextEntry.Hypothesis {

    String name();

    record VarDecl(String name, Type type) implements ContextEntry {
        @Override
        public String toString() {
            return name + " : " + type;
        }
    }

    record Hypothesis(String name, Expr formula) implements ContextEntry {
        @Override
        public String toString() {
            return name + " : " + Printer.show(formula);
        }
    }
}
