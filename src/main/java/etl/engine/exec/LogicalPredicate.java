package etl.engine.exec;

import etl.engine.data.Record;
import etl.engine.query.ast.LogicalOp;

/**
 * left AND/OR right, or NOT operand when op is null. Short-circuits like the
 * WHERE clause it was compiled from.
 */
public class LogicalPredicate implements Predicate {
    private final LogicalOp op;
    private final Predicate left;
    private final Predicate right;

    public LogicalPredicate(LogicalOp op, Predicate left, Predicate right) {
        if (op == null || left == null || right == null) {
            throw new IllegalArgumentException("AND/OR needs an operator and two operands");
        }
        this.op = op;
        this.left = left;
        this.right = right;
    }

    private LogicalPredicate(Predicate operand) {
        this.op = null;
        this.left = operand;
        this.right = null;
    }

    public static LogicalPredicate not(Predicate operand) {
        if (operand == null) throw new IllegalArgumentException("NOT needs an operand");
        return new LogicalPredicate(operand);
    }

    @Override
    public boolean test(Record row) {
        if (op == null) return !left.test(row);
        return switch (op) {
            case AND -> left.test(row) && right.test(row);
            case OR -> left.test(row) || right.test(row);
        };
    }

    @Override
    public String toString() {
        if (op == null) return "NOT (" + left + ")";
        return "(" + left + " " + op + " " + right + ")";
    }
}
