package etl.engine.query.ast;

import java.util.List;

/**
 * Either the wildcard or an explicit list of columns and aggregations.
 */
public record SelectColumns(boolean wildcard, List<SelectItem> items) {
    private static final SelectColumns ALL = new SelectColumns(true, List.of());

    public SelectColumns {
        items = List.copyOf(items);
        if (!wildcard && items.isEmpty()) throw new IllegalArgumentException("select list must not be empty");
    }

    public static SelectColumns all() { return ALL; }

    public static SelectColumns of(List<SelectItem> items) {
        return new SelectColumns(false, items);
    }

    public static SelectColumns of(SelectItem... items) {
        return new SelectColumns(false, List.of(items));
    }

    public boolean allAggregations() {
        if (wildcard) return false;
        for (SelectItem i : items) if (!(i instanceof Aggregation)) return false;
        return true;
    }

    public boolean anyAggregation() {
        for (SelectItem i : items) if (i instanceof Aggregation) return true;
        return false;
    }
}
