package fol.expr;

import fol.Printer;
import java.util.List;

/**
 * Application of a function or predicate symbol. A nullary predicate application is a propositional atom.
 */
public record Func(VarRef head, List<Expr> args) implements Expr {
    public Func {
        args = List.copyOf(args);
    }

    public static Func free(String name, List<Expr> args) {
        return new Func(new VarRef.Free(name), args);
    }

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        List<Expr> newArgs = args.stream().map(e -> e.updateVars(depth, update)).toList();
        return new Func(head, newArgs);
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        List<Expr> newArgs = args.stream().map(e -> e.updateFuncs(depth, update)).toList();
        return update.apply(depth, head, newArgs);
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        if (args.isEmpty()) {
            return Printer.name(stack, head);
        }
        return Printer.name(stack, head) + "("
                + String.join(", ", args.stream().map(e -> e.show(used, stack)).toArray(String[]::new)) + ")";
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
