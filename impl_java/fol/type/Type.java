package fol.type;

/**
 * Possible types of expressions:
 * <ul>
 *     <li>Terms: {@code FunctionType(0, TERM)}</li>
 *     <li>Functions: {@code FunctionType(k, TERM)}</li>
 *     <li>Formulas: {@code FunctionType(0, PROP)}</li>
 *     <li>Predicates: {@code FunctionType(k, PROP)}</li>
 * </ul>
 * Schemas have exactly one second-order abstraction in front of them, see {@link SchemaType}.
 */
public sealed interface Type permits FunctionType, SchemaType {

    FunctionType TERM = new FunctionType(0, Sort.TERM);
    FunctionType FORMULA = new FunctionType(0, Sort.PROP);
}
