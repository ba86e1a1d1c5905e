package fol.expr;

import fol.Printer;
import java.util.List;

public record Exists(String name, Expr body) implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new Exists(name, body.updateVars(depth + 1, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new Exists(name, body.updateFuncs(depth + 1, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        String x = Printer.freshName(name, used);
        return "(∃" + x + ". " + body.show(Printer.bind(used, x), Printer.bind(stack, x)) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Exists other)) return false;
        return body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return 31 * "∃".hashCode() + body.hashCode();
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
