package fol.expr;

import fol.Printer;
import java.util.List;

/**
 * Universal quantification over terms. The body's {@code Bound(0)} refers to the introduced variable.
 * The display name is ignored by {@link #equals(Object)}.
 */
public record Forall(String name, Expr body) implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new Forall(name, body.updateVars(depth + 1, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new Forall(name, body.updateFuncs(depth + 1, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        String x = Printer.freshName(name, used);
        return "(∀" + x + ". " + body.show(Printer.bind(used, x), Printer.bind(stack, x)) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Forall other)) return false;
        return body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return 31 * "∀".hashCode() + body.hashCode();
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
