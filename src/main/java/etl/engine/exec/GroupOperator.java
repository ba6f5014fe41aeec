package etl.engine.exec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.data.Values;
import etl.engine.query.ast.AggregateFunction;
import etl.engine.query.ast.SortDirection;

/**
 * Partitions rows by the group-key columns, keeping groups in the order their
 * key first appears, and emits one row per group. With no key columns the
 * whole input is a single group, which is how a select list made only of
 * aggregations collapses to one row.
 *
 * Optional sort keys are evaluated per group and used to order the output
 * before they are dropped.
 */
public class GroupOperator implements Operator {

    /**
     * One output cell per group: either the value of a group-key column
     * (function == null) or an aggregation over inputIndex (-1 for *).
     */
    public record Output(String name, int inputIndex, AggregateFunction function) {
        public static Output key(String name, int inputIndex) {
            return new Output(name, inputIndex, null);
        }

        public static Output aggregate(String name, AggregateFunction function, int inputIndex) {
            return new Output(name, inputIndex, function);
        }

        boolean isAggregate() {
            return function != null;
        }
    }

    public record OrderTerm(Output value, SortDirection direction) {}

    private final int[] keyIndexes;
    private final List<Output> outputs;
    private final List<OrderTerm> order;

    public GroupOperator(int[] keyIndexes, List<Output> outputs, List<OrderTerm> order) {
        this.keyIndexes = keyIndexes.clone();
        this.outputs = List.copyOf(outputs);
        this.order = order == null ? List.of() : List.copyOf(order);
    }

    @Override
    public Relation apply(Relation input) {
        Map<List<Object>, List<Record>> groups = partition(input);
        if (keyIndexes.length == 0 && groups.isEmpty()) groups.put(List.of(), List.of());

        List<String> names = new ArrayList<>();
        for (Output o : outputs) names.add(o.name());
        for (int i = 0; i < order.size(); i++) names.add("__order_" + i);

        List<Record> rows = new ArrayList<>(groups.size());
        for (List<Record> members : groups.values()) {
            List<Object> cells = new ArrayList<>(names.size());
            for (Output o : outputs) cells.add(evaluate(o, members, input));
            for (OrderTerm t : order) cells.add(evaluate(t.value(), members, input));
            rows.add(new Record(cells));
        }
        Relation grouped = new Relation(names, rows);
        if (order.isEmpty()) return grouped;

        List<SortKey> keys = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) keys.add(new SortKey(outputs.size() + i, order.get(i).direction()));
        Relation sorted = new SortOperator(keys).apply(grouped);
        int[] keep = new int[outputs.size()];
        for (int i = 0; i < keep.length; i++) keep[i] = i;
        return new ProjectionOperator(keep).apply(sorted);
    }

    private Map<List<Object>, List<Record>> partition(Relation input) {
        Map<List<Object>, List<Record>> groups = new LinkedHashMap<>();
        for (Record r : input.rows()) {
            List<Object> key = new ArrayList<>(keyIndexes.length);
            for (int idx : keyIndexes) key.add(Values.hashKey(r.get(idx)));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        return groups;
    }

    private Object evaluate(Output o, List<Record> members, Relation input) {
        if (!o.isAggregate()) return members.isEmpty() ? null : members.get(0).get(o.inputIndex());
        if (o.inputIndex() < 0) return Aggregator.applyWildcard(o.function(), members.size());
        List<Object> cells = new ArrayList<>(members.size());
        for (Record r : members) cells.add(r.get(o.inputIndex()));
        return Aggregator.apply(o.function(), cells, input.columns().get(o.inputIndex()));
    }
}
