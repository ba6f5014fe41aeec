package etl.engine.query.plan;

import java.util.List;

import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.Condition;
import etl.engine.query.ast.LimitClause;
import etl.engine.query.ast.OrderBy;
import etl.engine.query.ast.SelectColumns;

/**
 * Everything the transform stage needs. Absent clauses are null.
 */
public record TransformCriteria(
    SelectColumns columns,
    boolean distinct,
    Condition filter,
    List<ColumnRef> groupBy,
    OrderBy orderBy,
    LimitClause limit
) {
    public TransformCriteria {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        groupBy = groupBy == null ? null : List.copyOf(groupBy);
    }

    /** SELECT * with no other clause. */
    public static TransformCriteria selectAll() {
        return new TransformCriteria(SelectColumns.all(), false, null, null, null, null);
    }
}
