package fol.type;

public enum Sort {
    TERM,
    PROP;

    @Override
    public String toString() {
        return this == TERM ? "ι" : "*";
    }
}
