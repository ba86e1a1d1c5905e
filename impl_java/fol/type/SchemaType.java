package fol.type;

/**
 * {@code SchemaType(k1, s1, k2, s2)} stands for {@code (ι → ... → ι → s1) → ι → ... → ι → s2},
 * with k1 and k2 arguments respectively.
 */
public record SchemaType(int argArity, Sort argSort, int arity, Sort sort) implements Type {

    public FunctionType argType() {
        return new FunctionType(argArity, argSort);
    }

    public FunctionType resultType() {
        return new FunctionType(arity, sort);
    }

    @Override
    public String toString() {
        return "Schema(" + argType() + " → " + resultType() + ")";
    }
}
