package fol.expr;

import fol.Printer;
import java.util.List;

/**
 * Lambda abstraction over a term variable. Lambdas only occur at the outermost layers of an expression;
 * each one raises the functional arity of its body by one.
 */
public record Lam(String name, Expr body) implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new Lam(name, body.updateVars(depth + 1, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new Lam(name, body.updateFuncs(depth + 1, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        String x = Printer.freshName(name, used);
        return "λ" + x + ". " + body.show(Printer.bind(used, x), Printer.bind(stack, x));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Lam other)) return false;
        return body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return 31 * "λ".hashCode() + body.hashCode();
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
