package etl.engine.query.ast;

public record JoinEquality(ColumnRef left, ColumnRef right) implements JoinCondition {}
