package etl.engine.query.ast;

/**
 * Reference to a column, resolved against a relation's schema at execution time.
 */
public interface ColumnRef extends SelectItem, Operand {
    /** Text as written, used in diagnostics and output naming. */
    String describe();
}
