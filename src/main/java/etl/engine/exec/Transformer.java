package etl.engine.exec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.Aggregation;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.OrderBy;
import etl.engine.query.ast.OrderByParameter;
import etl.engine.query.ast.SelectColumns;
import etl.engine.query.ast.SelectItem;
import etl.engine.query.plan.TransformCriteria;

/**
 * Runs the transform stage of a plan. Stages, each on the previous output:
 *  1. filter (WHERE)
 *  2. row ordering, when there is no GROUP BY and the select list is not purely aggregations
 *  3. grouping with per-group aggregation and group ordering, when GROUP BY is present
 *  4. otherwise whole-relation aggregation or projection
 *  5. distinct
 *  6. limit / tail
 * Holds no state between calls.
 */
public class Transformer {
    private final PredicateCompiler predicates = new PredicateCompiler();

    public Relation transform(Relation relation, TransformCriteria criteria) {
        return transform(relation, criteria, AliasBindings.none());
    }

    public Relation transform(Relation relation, TransformCriteria criteria, AliasBindings bindings) {
        if (relation == null) throw new QueryException(ErrorKind.NULL_INPUT, "Input relation is null");
        if (criteria == null) throw new IllegalArgumentException("criteria must not be null");

        SelectColumns columns = criteria.columns();
        boolean onlyAggregations = columns.allAggregations();
        LimitOperator limit = criteria.limit() == null ? null
            : new LimitOperator(criteria.limit().kind(), criteria.limit().count());

        Relation data = relation;
        if (criteria.filter() != null) {
            Predicate p = predicates.compile(criteria.filter(), new ColumnResolver(data.columns(), bindings));
            data = new FilterOperator(p).apply(data);
        }

        if (criteria.groupBy() == null && criteria.orderBy() != null && !onlyAggregations) {
            data = sortRows(data, criteria.orderBy(), bindings);
        }

        if (criteria.groupBy() != null) {
            data = group(data, criteria, bindings);
        } else if (!columns.wildcard()) {
            if (onlyAggregations) {
                data = aggregateAll(data, columns, bindings);
            } else if (columns.anyAggregation()) {
                throw new QueryException(ErrorKind.MIXED_AGGREGATION_WITHOUT_GROUP,
                    "Aggregation functions mixed with plain columns require GROUP BY");
            } else {
                data = project(data, columns, bindings);
            }
        }

        if (criteria.distinct()) data = new DistinctOperator().apply(data);
        if (limit != null) data = limit.apply(data);
        return data;
    }

    private Relation sortRows(Relation data, OrderBy orderBy, AliasBindings bindings) {
        ColumnResolver resolver = new ColumnResolver(data.columns(), bindings);
        List<SortKey> keys = new ArrayList<>();
        for (OrderByParameter p : orderBy.parameters()) {
            if (!(p.parameter() instanceof ColumnRef ref)) {
                throw new QueryException(ErrorKind.INVALID_ORDER_BY,
                    "ORDER BY on an aggregation requires GROUP BY");
            }
            keys.add(new SortKey(data.indexOf(resolver.resolveExact(ref)), p.direction()));
        }
        return new SortOperator(keys).apply(data);
    }

    private Relation group(Relation data, TransformCriteria criteria, AliasBindings bindings) {
        ColumnResolver resolver = new ColumnResolver(data.columns(), bindings);

        // first occurrence wins, so GROUP BY a, #0 with a at #0 keeps one key
        Set<String> keyNames = new LinkedHashSet<>();
        for (ColumnRef ref : criteria.groupBy()) keyNames.add(resolver.resolve(ref));
        int[] keyIndexes = keyNames.stream().mapToInt(data::indexOf).toArray();

        List<GroupOperator.Output> outputs = new ArrayList<>();
        SelectColumns columns = criteria.columns();
        if (columns.wildcard()) {
            for (String c : data.columns()) outputs.add(keyOutput(c, keyNames, data));
        } else {
            for (SelectItem item : columns.items()) {
                if (item instanceof Aggregation agg) outputs.add(aggregateOutput(agg, resolver));
                else outputs.add(keyOutput(resolver.resolve((ColumnRef) item), keyNames, data));
            }
        }

        List<GroupOperator.OrderTerm> order = new ArrayList<>();
        if (criteria.orderBy() != null) {
            for (OrderByParameter p : criteria.orderBy().parameters()) {
                GroupOperator.Output value = p.parameter() instanceof Aggregation agg
                    ? aggregateOutput(agg, resolver, true)
                    : keyOutput(resolver.resolveExact((ColumnRef) p.parameter()), keyNames, data);
                order.add(new GroupOperator.OrderTerm(value, p.direction()));
            }
        }
        return new GroupOperator(keyIndexes, outputs, order).apply(data);
    }

    private Relation aggregateAll(Relation data, SelectColumns columns, AliasBindings bindings) {
        ColumnResolver resolver = new ColumnResolver(data.columns(), bindings);
        List<GroupOperator.Output> outputs = new ArrayList<>();
        for (SelectItem item : columns.items()) outputs.add(aggregateOutput((Aggregation) item, resolver));
        return new GroupOperator(new int[0], outputs, null).apply(data);
    }

    private Relation project(Relation data, SelectColumns columns, AliasBindings bindings) {
        ColumnResolver resolver = new ColumnResolver(data.columns(), bindings);
        List<String> names = new ArrayList<>();
        for (SelectItem item : columns.items()) names.add(resolver.resolve((ColumnRef) item));
        return ProjectionOperator.forColumnNames(data.columns(), names).apply(data);
    }

    private static GroupOperator.Output keyOutput(String name, Set<String> keyNames, Relation data) {
        if (!keyNames.contains(name)) {
            throw new QueryException(ErrorKind.COLUMN_NOT_IN_GROUP_BY,
                "Column '" + name + "' must appear in GROUP BY or be aggregated. Group keys: " + keyNames);
        }
        return GroupOperator.Output.key(name, data.indexOf(name));
    }

    private static GroupOperator.Output aggregateOutput(Aggregation agg, ColumnResolver resolver) {
        return aggregateOutput(agg, resolver, false);
    }

    private static GroupOperator.Output aggregateOutput(Aggregation agg, ColumnResolver resolver, boolean exact) {
        if (agg.isWildcard()) return GroupOperator.Output.aggregate(agg.outputName(null), agg.function(), -1);
        String name = exact ? resolver.resolveExact(agg.column()) : resolver.resolve(agg.column());
        return GroupOperator.Output.aggregate(agg.outputName(name), agg.function(), resolver.columns().indexOf(name));
    }
}
