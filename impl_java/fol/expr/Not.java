package fol.expr;

import fol.Printer;
import java.util.List;

public record Not(Expr formula) implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new Not(formula.updateVars(depth, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new Not(formula.updateFuncs(depth, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        return "¬" + formula.show(used, stack);
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
