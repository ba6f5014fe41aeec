package etl.engine.query.ast;

/**
 * Root of a parsed statement tree.
 */
public interface Statement {}
