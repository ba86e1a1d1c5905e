package fol.expr;

import fol.Printer;
import java.util.List;

public record SchemaApp(VarRef head, Expr arg) implements Expr {

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new SchemaApp(head, arg.updateVars(depth, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new SchemaApp(head, arg.updateFuncs(depth, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        return Printer.name(stack, head) + "[" + arg.show(used, stack) + "]";
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
