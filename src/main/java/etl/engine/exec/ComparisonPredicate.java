package etl.engine.exec;

import etl.engine.data.Record;
import etl.engine.data.Values;
import etl.engine.query.ast.ComparisonOp;

/**
 * left op right over dynamically typed cells.
 * A null on either side makes every operator false except !=, which is true.
 * = and != across a number and a string are false / true; ordering across
 * them fails with TYPE_MISMATCH.
 */
public class ComparisonPredicate implements Predicate {
    private final ValueSource left;
    private final ComparisonOp op;
    private final ValueSource right;

    public ComparisonPredicate(ValueSource left, ComparisonOp op, ValueSource right) {
        this.left = left;
        this.op = op;
        this.right = right;
    }

    @Override
    public boolean test(Record row) {
        Object l = left.value(row);
        Object r = right.value(row);
        if (l == null || r == null) return op == ComparisonOp.NE;
        return switch (op) {
            case EQ -> Values.looselyEquals(l, r);
            case NE -> !Values.looselyEquals(l, r);
            case LT -> Values.compare(l, r) < 0;
            case LE -> Values.compare(l, r) <= 0;
            case GT -> Values.compare(l, r) > 0;
            case GE -> Values.compare(l, r) >= 0;
        };
    }

    @Override
    public String toString() { return left + " " + op.symbol() + " " + right; }
}
