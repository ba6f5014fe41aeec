package etl.engine.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.Aggregation;
import etl.engine.query.ast.BinaryJoinCondition;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.Comparison;
import etl.engine.query.ast.Condition;
import etl.engine.query.ast.JoinClause;
import etl.engine.query.ast.JoinCondition;
import etl.engine.query.ast.JoinEquality;
import etl.engine.query.ast.Like;
import etl.engine.query.ast.Logical;
import etl.engine.query.ast.LogicalOp;
import etl.engine.query.ast.Not;
import etl.engine.query.ast.Operand;
import etl.engine.query.ast.OrderByParameter;
import etl.engine.query.ast.QualifiedColumn;
import etl.engine.query.ast.SelectItem;
import etl.engine.query.ast.SelectStatement;
import etl.engine.query.ast.TableSource;
import etl.engine.query.plan.ExecutionPlan;
import etl.engine.query.plan.ExtractStep;
import etl.engine.query.plan.JoinKey;
import etl.engine.query.plan.JoinStep;
import etl.engine.query.plan.LoadStep;
import etl.engine.query.plan.PlanStep;
import etl.engine.query.plan.TransformCriteria;
import etl.engine.query.plan.TransformStep;

/**
 * Lowers a SelectStatement into an ExecutionPlan:
 *  1. one ExtractStep per datasource, FROM first then each JOIN source in clause order;
 *  2. one JoinStep per JOIN clause, folded left to right in the order written (no reordering);
 *  3. a single TransformStep carrying the criteria bundle;
 *  4. a LoadStep when INTO was given.
 */
public class QueryPlanner {
    private enum Side { LEFT, RIGHT }

    public ExecutionPlan plan(SelectStatement select) {
        if (select == null) throw new QueryException(ErrorKind.NULL_INPUT, "Cannot plan a null statement");

        Map<String, String> aliases = new LinkedHashMap<>();
        List<ExtractStep> extracts = new ArrayList<>();
        extracts.add(extractStep(0, select.source(), aliases));
        for (int i = 0; i < select.joins().size(); i++) {
            extracts.add(extractStep(i + 1, select.joins().get(i).source(), aliases));
        }

        List<PlanStep> steps = new ArrayList<>(extracts);
        Set<String> accumulated = new HashSet<>();
        if (select.source().alias() != null) accumulated.add(select.source().alias());
        for (int i = 0; i < select.joins().size(); i++) {
            JoinClause join = select.joins().get(i);
            ExtractStep right = extracts.get(i + 1);
            List<JoinKey> keys = new ArrayList<>();
            for (JoinEquality eq : equalities(join.on())) {
                keys.add(orient(eq, accumulated, right.alias(), aliases));
            }
            steps.add(new JoinStep(right.id(), join.type(), keys));
            if (right.alias() != null) accumulated.add(right.alias());
        }

        checkAliases(select, aliases);

        steps.add(new TransformStep(new TransformCriteria(
            select.columns(), select.distinct(), select.where(), select.groupBy(), select.orderBy(), select.limit())));
        if (select.into() != null) steps.add(new LoadStep(select.into()));
        return new ExecutionPlan(steps, aliases);
    }

    private ExtractStep extractStep(int index, TableSource source, Map<String, String> aliases) {
        String id = "extract_" + index;
        String alias = source.alias();
        if (alias != null) {
            if (aliases.containsKey(alias)) {
                throw new QueryException(ErrorKind.DUPLICATE_ALIAS, "Alias '" + alias + "' is used more than once");
            }
            aliases.put(alias, id);
        }
        return new ExtractStep(id, source.datasource(), alias);
    }

    // Flattens an AND tree of equalities. OR cannot be expressed as key matching.
    private List<JoinEquality> equalities(JoinCondition on) {
        List<JoinEquality> out = new ArrayList<>();
        collect(on, out);
        return out;
    }

    private void collect(JoinCondition c, List<JoinEquality> out) {
        if (c instanceof JoinEquality eq) {
            out.add(eq);
        } else if (c instanceof BinaryJoinCondition b) {
            if (b.op() == LogicalOp.OR) {
                throw new QueryException(ErrorKind.UNSUPPORTED_JOIN_CONDITION,
                    "OR is not supported in JOIN ... ON; only a single equality or equalities joined by AND");
            }
            collect(b.left(), out);
            collect(b.right(), out);
        } else {
            throw new IllegalStateException("Unknown join condition: " + c);
        }
    }

    private JoinKey orient(JoinEquality eq, Set<String> accumulated, String rightAlias, Map<String, String> aliases) {
        Side ls = sideOf(eq.left(), accumulated, rightAlias, aliases);
        Side rs = sideOf(eq.right(), accumulated, rightAlias, aliases);
        if (ls != null && ls == rs) {
            throw new QueryException(ErrorKind.UNSUPPORTED_JOIN_CONDITION,
                "Join condition " + eq.left().describe() + " = " + eq.right().describe()
                    + " compares two columns of the same side");
        }
        if (ls == Side.RIGHT || rs == Side.LEFT) return new JoinKey(eq.right(), eq.left());
        return new JoinKey(eq.left(), eq.right());
    }

    private Side sideOf(ColumnRef ref, Set<String> accumulated, String rightAlias, Map<String, String> aliases) {
        if (!(ref instanceof QualifiedColumn q)) return null;
        if (q.alias().equals(rightAlias)) return Side.RIGHT;
        if (accumulated.contains(q.alias())) return Side.LEFT;
        if (aliases.containsKey(q.alias())) {
            throw new QueryException(ErrorKind.UNSUPPORTED_JOIN_CONDITION,
                "Join condition refers to '" + q.alias() + "' before it is joined");
        }
        throw unknownAlias(q);
    }

    // Every qualified column outside ON clauses must name a declared alias.
    private void checkAliases(SelectStatement select, Map<String, String> aliases) {
        List<ColumnRef> refs = new ArrayList<>();
        for (SelectItem item : select.columns().items()) addRef(item, refs);
        if (select.where() != null) addRefs(select.where(), refs);
        if (select.groupBy() != null) refs.addAll(select.groupBy());
        if (select.orderBy() != null) {
            for (OrderByParameter p : select.orderBy().parameters()) addRef(p.parameter(), refs);
        }
        for (ColumnRef r : refs) {
            if (r instanceof QualifiedColumn q && !aliases.containsKey(q.alias())) throw unknownAlias(q);
        }
    }

    private void addRef(SelectItem item, List<ColumnRef> refs) {
        if (item instanceof ColumnRef c) refs.add(c);
        else if (item instanceof Aggregation a && a.column() != null) refs.add(a.column());
    }

    private void addRefs(Condition c, List<ColumnRef> refs) {
        if (c instanceof Comparison cmp) {
            addOperand(cmp.left(), refs);
            addOperand(cmp.right(), refs);
        } else if (c instanceof Like like) {
            addOperand(like.operand(), refs);
        } else if (c instanceof Not not) {
            addRefs(not.operand(), refs);
        } else if (c instanceof Logical l) {
            addRefs(l.left(), refs);
            addRefs(l.right(), refs);
        }
    }

    private void addOperand(Operand o, List<ColumnRef> refs) {
        if (o instanceof ColumnRef c) refs.add(c);
    }

    private static QueryException unknownAlias(QualifiedColumn q) {
        return new QueryException(ErrorKind.UNKNOWN_ALIAS, "Unknown table alias '" + q.alias() + "' in " + q.describe());
    }
}
