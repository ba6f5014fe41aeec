package etl.engine.query.ast;

/**
 * WHERE clause tree.
 */
public interface Condition {}
