package etl.engine.query.ast;

public record JoinClause(JoinType type, TableSource source, JoinCondition on) {}
