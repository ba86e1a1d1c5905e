package fol.expr;

import fol.Printer;
import java.util.List;

public record Iff(Expr left, Expr right) implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new Iff(left.updateVars(depth, update), right.updateVars(depth, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new Iff(left.updateFuncs(depth, update), right.updateFuncs(depth, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        return "(" + left.show(used, stack) + " ↔ " + right.show(used, stack) + ")";
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
