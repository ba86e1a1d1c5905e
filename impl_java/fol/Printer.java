package fol;

import fol.expr.Expr;
import fol.expr.VarRef;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Debug display of expressions. Binder names are cosmetic: each binder gets its display name primed
 * until it no longer collides with a name in scope.
 */
public final class Printer {

    private Printer() {
    }

    public static String show(Expr e) {
        return e.show(List.of(), List.of());
    }

    public static String show(Expr e, Collection<String> used) {
        return e.show(List.copyOf(used), List.of());
    }

    public static String freshName(String name, Collection<String> used) {
        String out = name;
        while (used.contains(out)) {
            out = out + "'";
        }
        return out;
    }

    public static String name(List<String> stack, VarRef ref) {
        if (ref instanceof VarRef.Bound bound) {
            // Escaping indices only show up when printing open subexpressions
            return bound.index() < stack.size() ? stack.get(bound.index()) : bound.toString();
        }
        return ref.toString();
    }

    /**
     * Returns a new list with {@code name} in front.
     */
    public static List<String> bind(List<String> names, String name) {
        List<String> out = new ArrayList<>(names.size() + 1);
        out.add(name);
        out.addAll(names);
        return out;
    }
}
