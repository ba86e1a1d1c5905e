package fol.expr;

/**
 * A reference to a variable or function symbol. Bound variables are represented using de Bruijn indices
 * (0 = binds to the innermost binder, 1 = escapes one binder, and so on).
 */
public sealed interface VarRef permits VarRef.Free, VarRef.Bound {

    record Free(String name) implements VarRef {
        @Override
        public String toString() {
            return name;
        }
    }

    record Bound(int index) implements VarRef {
        public Bound {
            if (index < 0) throw new IllegalArgumentException("Negative de Bruijn index: " + index);
        }

        @Override
        public String toString() {
            return "#" + index;
        }
    }

    static VarRef free(String name) {
        return new Free(name);
    }

    static VarRef bound(int index) {
        return new Bound(index);
    }
}
