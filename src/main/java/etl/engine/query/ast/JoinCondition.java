package etl.engine.query.ast;

/**
 * ON clause tree: equalities combined with AND / OR.
 */
public interface JoinCondition {}
