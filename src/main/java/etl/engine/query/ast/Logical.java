package etl.engine.query.ast;

public record Logical(LogicalOp op, Condition left, Condition right) implements Condition {}
