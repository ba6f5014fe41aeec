package etl.engine.query.ast;

public record BinaryJoinCondition(LogicalOp op, JoinCondition left, JoinCondition right) implements JoinCondition {}
