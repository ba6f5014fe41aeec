package etl.engine.exec;

import etl.engine.data.Values;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.Comparison;
import etl.engine.query.ast.Condition;
import etl.engine.query.ast.Like;
import etl.engine.query.ast.Literal;
import etl.engine.query.ast.Logical;
import etl.engine.query.ast.Not;
import etl.engine.query.ast.Operand;

/**
 * Compiles a WHERE condition tree into a physical Predicate whose column
 * references are already resolved to row positions.
 */
public class PredicateCompiler {

    public Predicate compile(Condition condition, ColumnResolver resolver) {
        if (condition == null) throw new IllegalArgumentException("condition must not be null");
        if (condition instanceof Comparison c) {
            return new ComparisonPredicate(source(c.left(), resolver), c.op(), source(c.right(), resolver));
        }
        if (condition instanceof Like like) {
            return new LikePredicate(source(like.operand(), resolver), like.pattern());
        }
        if (condition instanceof Not not) {
            return LogicalPredicate.not(compile(not.operand(), resolver));
        }
        if (condition instanceof Logical l) {
            return new LogicalPredicate(l.op(), compile(l.left(), resolver), compile(l.right(), resolver));
        }
        throw new IllegalStateException("Unsupported condition: " + condition);
    }

    private ValueSource source(Operand operand, ColumnResolver resolver) {
        if (operand instanceof Literal lit) return ValueSource.constant(Values.normalize(lit.value()));
        if (operand instanceof ColumnRef ref) {
            String name = resolver.resolve(ref);
            return ValueSource.column(resolver.columns().indexOf(name), name);
        }
        throw new IllegalStateException("Unsupported operand: " + operand);
    }
}
