package etl.engine.query.plan;

import etl.engine.query.ast.ColumnRef;

/**
 * One equality of an ON clause, oriented: left resolves against the
 * accumulated relation, right against the relation being joined.
 */
public record JoinKey(ColumnRef left, ColumnRef right) {}
