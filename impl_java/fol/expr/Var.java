package fol.expr;

import fol.Printer;
import java.util.List;

public record Var(VarRef ref) implements Expr {

    public static Var free(String name) {
        return new Var(new VarRef.Free(name));
    }

    public static Var bound(int index) {
        return new Var(new VarRef.Bound(index));
    }

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return update.apply(depth, ref);
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return this;
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        return Printer.name(stack, ref);
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
