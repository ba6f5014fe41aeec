package etl.engine.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.data.Values;
import etl.engine.query.ast.SortDirection;

/**
 * Stable multi-key sort. Keys are applied in priority order, each with its own
 * direction. Nulls go last whatever the direction.
 */
public class SortOperator implements Operator {
    private final List<SortKey> keys;

    public SortOperator(List<SortKey> keys) {
        if (keys == null || keys.isEmpty()) throw new IllegalArgumentException("sort needs at least one key");
        this.keys = List.copyOf(keys);
    }

    @Override
    public Relation apply(Relation input) {
        List<Record> rows = new ArrayList<>(input.rows());
        rows.sort(comparator(keys)); // List.sort is a stable merge sort
        return input.withRows(rows);
    }

    static Comparator<Record> comparator(List<SortKey> keys) {
        return (a, b) -> {
            for (SortKey k : keys) {
                int c = compareCells(a.get(k.columnIndex()), b.get(k.columnIndex()), k.direction());
                if (c != 0) return c;
            }
            return 0;
        };
    }

    private static int compareCells(Object x, Object y, SortDirection dir) {
        if (x == null || y == null) {
            if (x == y) return 0;
            return x == null ? 1 : -1;
        }
        int c = Values.compare(x, y);
        return dir == SortDirection.DESC ? -c : c;
    }
}
