package etl.engine.query.ast;

public record Not(Condition operand) implements Condition {}
