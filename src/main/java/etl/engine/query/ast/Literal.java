package etl.engine.query.ast;

public record Literal(Object value) implements Operand {}
