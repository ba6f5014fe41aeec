package etl.engine.query.ast;

public record Comparison(Operand left, ComparisonOp op, Operand right) implements Condition {}
