package fol.type;

public record FunctionType(int arity, Sort sort) implements Type {

    public boolean isTerm() {
        return arity == 0 && sort == Sort.TERM;
    }

    public boolean isFormula() {
        return arity == 0 && sort == Sort.PROP;
    }

    @Override
    public String toString() {
        if (isTerm()) return "Term";
        if (isFormula()) return "Formula";
        return (sort == Sort.TERM ? "Func" : "Pred") + "\\" + arity;
    }
}
