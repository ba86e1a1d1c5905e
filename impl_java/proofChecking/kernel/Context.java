package proofChecking.kernel;

import fol.type.FunctionType;
import fol.type.SchemaType;
import fol.type.Sort;
import fol.type.Type;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Ordered list of declarations and hypotheses, newest first. Extending a context never modifies it: the
 * extension shares all of its entries. Names are unique, so a free name in a theorem keeps referring to the
 * same entry under every weakening and every context-changing rule.
 */
public final class Context implements Iterable<ContextEntry> {

    private static final Context EMPTY = new Context(null, null);

    private final ContextEntry front;
    private final Context rest;
    private final int size;
    private final int hash;

    private Context(ContextEntry front, Context rest) {
        this.front = front;
        this.rest = rest;
        this.size = rest == null ? 0 : rest.size + 1;
        this.hash = rest == null ? 1 : 31 * rest.hash + front.hashCode();
    }

    public static Context empty() {
        return EMPTY;
    }

    public Context extendVar(String name) {
        return extend(new ContextEntry.VarDecl(name, Type.TERM));
    }

    public Context extendFunc(String name, int arity, Sort sort) {
        if (arity < 0) {
            throw new KernelException(KernelException.Reason.ARITY_MISMATCH, "negative arity " + arity, name);
        }
        return extend(new ContextEntry.VarDecl(name, new FunctionType(arity, sort)));
    }

    public Context extendSchema(String name, int argArity, Sort argSort, int arity, Sort sort) {
        if (argArity < 0 || arity < 0) {
            throw new KernelException(KernelException.Reason.ARITY_MISMATCH, "negative arity", name);
        }
        return extend(new ContextEntry.VarDecl(name, new SchemaType(argArity, argSort, arity, sort)));
    }

    /**
     * Assumes a formula. No proof is needed, but the formula must have been checked in this context.
     */
    public Context extendHyp(String name, Theorem formula) {
        if (!(formula.judgment() instanceof Judgment.HasType hasType) || !hasType.type().equals(Type.FORMULA)) {
            throw new KernelException(KernelException.Reason.SHAPE_MISMATCH,
                    "hypothesis " + name + " is not a formula", formula.judgment());
        }
        if (!formula.context().equals(this)) {
            throw new KernelException(KernelException.Reason.CONTEXT_MISMATCH,
                    "hypothesis " + name + " was checked in another context", formula);
        }
        return extend(new ContextEntry.Hypothesis(name, hasType.expr()));
    }

    private Context extend(ContextEntry entry) {
        if (lookup(entry.name()).isPresent()) {
            throw new KernelException(KernelException.Reason.DUPLICATE_NAME,
                    entry.name() + " is already declared", entry);
        }
        return new Context(entry, this);
    }

    public Optional<ContextEntry> lookup(String name) {
        for (ContextEntry entry : this) {
            if (entry.name().equals(name)) return Optional.of(entry);
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * @return the most recently added entry, if any
     */
    public Optional<ContextEntry> front() {
        return Optional.ofNullable(front);
    }

    /**
     * @return the context without its most recently added entry
     */
    Context rest() {
        if (isEmpty()) throw new NoSuchElementException("empty context");
        return rest;
    }

    /**
     * Checks whether {@code other} is this context with zero or more entries removed from the front.
     */
    public boolean hasSuffix(Context other) {
        if (other.size > size) return false;
        Context curr = this;
        for (int i = other.size; i < size; i++) {
            curr = curr.rest;
        }
        return curr.equals(other);
    }

    /**
     * @return entry names, newest first
     */
    public List<String> names() {
        List<String> out = new ArrayList<>(size);
        for (ContextEntry entry : this) out.add(entry.name());
        return out;
    }

    @Override
    public Iterator<ContextEntry> iterator() {
        return new Iterator<>() {
            private Context curr = Context.this;

            @Override
            public boolean hasNext() {
                return !curr.isEmpty();
            }

            @Override
            public ContextEntry next() {
                if (curr.isEmpty()) throw new NoSuchElementException();
                ContextEntry out = curr.front;
                curr = curr.rest;
                return out;
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Context other)) return false;
        if (size != other.size || hash != other.hash) return false;
        Context a = this;
        Context b = other;
        while (a != b) {
            if (!a.front.equals(b.front)) return false;
            a = a.rest;
            b = b.rest;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        // Oldest entry first
        StringBuilder sb = new StringBuilder();
        for (ContextEntry entry : this) {
            sb.insert(0, entry + "\n");
        }
        return sb.toString();
    }
}
