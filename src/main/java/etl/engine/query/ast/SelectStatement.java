package etl.engine.query.ast;

import java.util.List;

/**
 * Parsed SELECT. Optional clauses are null when absent; joins is never null.
 */
public record SelectStatement(
    boolean distinct,
    SelectColumns columns,
    Datasource into,
    TableSource source,
    List<JoinClause> joins,
    Condition where,
    List<ColumnRef> groupBy,
    OrderBy orderBy,
    LimitClause limit
) implements Statement {
    public SelectStatement {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        if (source == null) throw new IllegalArgumentException("source must not be null");
        joins = joins == null ? List.of() : List.copyOf(joins);
        groupBy = groupBy == null ? null : List.copyOf(groupBy);
    }
}
