package proofChecking.elaborator;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import proofChecking.kernel.Theorem;

/**
 * Stack of named theorem tables, one per open scope. Lookup searches from the innermost scope outwards,
 * so inner names shadow outer ones without deleting them.
 */
public class TheoremPool {

    private final Deque<Map<String, Theorem>> scopes = new ArrayDeque<>();

    public TheoremPool() {
        scopes.push(new LinkedHashMap<>());
    }

    public void push() {
        scopes.push(new LinkedHashMap<>());
    }

    /**
     * Removes the innermost scope and returns its table, in insertion order.
     */
    public Map<String, Theorem> pop() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the outermost scope");
        }
        return scopes.pop();
    }

    /**
     * Adds a theorem to the innermost scope, replacing any theorem of the same name in that scope.
     */
    public Theorem addTheorem(String name, Theorem thm) {
        scopes.peek().put(name, thm);
        return thm;
    }

    public Optional<Theorem> lookup(String name) {
        for (Map<String, Theorem> scope : scopes) {
            Theorem thm = scope.get(name);
            if (thm != null) return Optional.of(thm);
        }
        return Optional.empty();
    }

    /**
     * Number of open scopes, the outermost one included.
     */
    public int depth() {
        return scopes.size();
    }

    /**
     * The innermost table; read-only.
     */
    public Map<String, Theorem> innermost() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(scopes.peek()));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Iterator<Map<String, Theorem>> it = scopes.descendingIterator();
        int level = 0;
        while (it.hasNext()) {
            String indent = "  ".repeat(level++);
            for (var entry : it.next().entrySet()) {
                sb.append(indent).append("* ").append(entry.getKey()).append(": ")
                        .append(entry.getValue().judgment().show(entry.getValue().context().names()))
                        .append("\n");
            }
        }
        return sb.toString();
    }
}
