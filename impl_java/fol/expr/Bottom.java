package fol.expr;

import java.util.List;

public record Bottom() implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return this;
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return this;
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        return "⊥";
    }

    @Override
    public String toString() {
        return "⊥";
    }
}
