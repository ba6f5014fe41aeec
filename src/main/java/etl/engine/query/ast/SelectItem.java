package etl.engine.query.ast;

/**
 * Entry of a select list or ORDER BY: a column reference or an aggregation.
 */
public interface SelectItem {}
