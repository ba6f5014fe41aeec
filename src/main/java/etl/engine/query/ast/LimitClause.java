package etl.engine.query.ast;

/**
 * LIMIT n keeps the first n rows, TAIL n the last n. The count is validated at
 * execution time.
 */
public record LimitClause(Kind kind, long count) {
    public enum Kind { LIMIT, TAIL }
}
