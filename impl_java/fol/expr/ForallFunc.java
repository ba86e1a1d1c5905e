package fol.expr;

import fol.Printer;
import fol.type.FunctionType;
import fol.type.Sort;
import java.util.List;

/**
 * Universal quantification over a function ({@link Sort#TERM}) or predicate ({@link Sort#PROP}) symbol.
 * This must be at the outermost layer of an expression. Occurrences of the symbol in the body are
 * {@link Func} heads with {@code Bound(n)} at depth n.
 */
public record ForallFunc(String name, int arity, Sort sort, Expr body) implements Expr {

    public FunctionType type() {
        return new FunctionType(arity, sort);
    }

    @Override
    public Expr updateVars(int depth, VarUpdate update) {
        return new ForallFunc(name, arity, sort, body.updateVars(depth + 1, update));
    }

    @Override
    public Expr updateFuncs(int depth, FuncUpdate update) {
        return new ForallFunc(name, arity, sort, body.updateFuncs(depth + 1, update));
    }

    @Override
    public String show(List<String> used, List<String> stack) {
        String x = Printer.freshName(name, used);
        String kind = sort == Sort.TERM ? "func " : "pred ";
        return "(∀" + kind + x + "\\" + arity + ". "
                + body.show(Printer.bind(used, x), Printer.bind(stack, x)) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof ForallFunc other)) return false;
        return arity == other.arity && sort == other.sort && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * arity + sort.hashCode()) + body.hashCode();
    }

    @Override
    public String toString() {
        return Printer.show(this);
    }
}
