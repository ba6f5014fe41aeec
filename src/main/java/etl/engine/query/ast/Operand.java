package etl.engine.query.ast;

/**
 * Side of a WHERE comparison: a column reference or a literal.
 */
public interface Operand {}
