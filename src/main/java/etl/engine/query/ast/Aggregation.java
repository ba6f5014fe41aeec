package etl.engine.query.ast;

/**
 * function(column) or function(*). A null column means the wildcard.
 */
public record Aggregation(AggregateFunction function, ColumnRef column) implements SelectItem {
    public Aggregation {
        if (function == null) throw new IllegalArgumentException("function must not be null");
        if (column == null && !function.acceptsWildcard()) {
            throw new IllegalArgumentException(function.sqlName() + " cannot be applied to *");
        }
    }

    public static Aggregation wildcard(AggregateFunction function) {
        return new Aggregation(function, null);
    }

    public boolean isWildcard() {
        return column == null;
    }

    /** Output column name once the argument is resolved, e.g. sum(amount). */
    public String outputName(String resolvedColumn) {
        return function.sqlName() + "(" + (resolvedColumn == null ? "*" : resolvedColumn) + ")";
    }
}
