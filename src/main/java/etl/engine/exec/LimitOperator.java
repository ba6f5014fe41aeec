package etl.engine.exec;

import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.LimitClause;

/**
 * LIMIT n keeps the first n rows, TAIL n the last n. n = 0 gives an empty
 * relation with the input's columns.
 */
public class LimitOperator implements Operator {
    private final LimitClause.Kind kind;
    private final long count;

    public LimitOperator(LimitClause.Kind kind, long count) {
        if (count < 0) {
            throw new QueryException(ErrorKind.INVALID_LIMIT, kind + " requires a non-negative integer but got " + count);
        }
        this.kind = kind;
        this.count = count;
    }

    @Override
    public Relation apply(Relation input) {
        int size = input.rowCount();
        int n = (int) Math.min(count, size);
        if (n == 0) return Relation.empty(input.columns());
        if (kind == LimitClause.Kind.LIMIT) return input.withRows(input.rows().subList(0, n));
        return input.withRows(input.rows().subList(size - n, size));
    }
}
