package etl.engine.query.ast;

/** operand LIKE 'pattern' with % and _ wildcards. */
public record Like(Operand operand, String pattern) implements Condition {}
