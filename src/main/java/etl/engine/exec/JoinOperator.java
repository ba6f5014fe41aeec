package etl.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.data.Values;
import etl.engine.error.ErrorKind;
import etl.engine.error.MissingJoinColumnException;
import etl.engine.error.QueryException;

/**
 * Hash equi-join of two relations on one or more key column pairs.
 * Output columns are the left columns followed by the right ones. A key pair
 * sharing one name collapses into a single column; any other name present
 * on both sides gets a _left / _right suffix. Null keys never match.
 */
public final class JoinOperator {
    public static final String LEFT_SUFFIX = "_left";
    public static final String RIGHT_SUFFIX = "_right";

    private JoinOperator() {}

    public static Relation join(Relation left, Relation right, String leftColumn, String rightColumn, String kind) {
        return join(left, right, List.of(leftColumn), List.of(rightColumn), JoinKind.parse(kind));
    }

    public static Relation join(Relation left, Relation right, String leftColumn, String rightColumn, JoinKind kind) {
        return join(left, right, List.of(leftColumn), List.of(rightColumn), kind);
    }

    /**
     * Joins on leftColumns[i] = rightColumns[i] for every i.
     * Empty inputs short-circuit before the key columns are checked:
     * both empty gives an empty relation; an empty left gives empty for
     * inner/left and a copy of right otherwise; an empty right gives empty
     * for inner/right and a copy of left otherwise.
     */
    public static Relation join(Relation left, Relation right, List<String> leftColumns, List<String> rightColumns, JoinKind kind) {
        if (left == null || right == null) throw new QueryException(ErrorKind.NULL_INPUT, "Join inputs must not be null");
        if (kind == null) throw new QueryException(ErrorKind.INVALID_JOIN_KIND, "Join kind must not be null");
        if (leftColumns.isEmpty() || leftColumns.size() != rightColumns.size()) {
            throw new IllegalArgumentException("Join needs matching non-empty key lists: " + leftColumns + " / " + rightColumns);
        }

        if (left.isEmpty() && right.isEmpty()) return Relation.empty();
        if (left.isEmpty()) return (kind == JoinKind.INNER || kind == JoinKind.LEFT) ? Relation.empty() : right.copy();
        if (right.isEmpty()) return (kind == JoinKind.INNER || kind == JoinKind.RIGHT) ? Relation.empty() : left.copy();

        int[] leftKeys = keyIndexes(left, leftColumns, MissingJoinColumnException.Side.LEFT);
        int[] rightKeys = keyIndexes(right, rightColumns, MissingJoinColumnException.Side.RIGHT);
        try {
            return new Merge(left, right, leftKeys, rightKeys, kind).run();
        } catch (RuntimeException e) {
            throw new QueryException(ErrorKind.JOIN_FAILED, "Error during join: " + e.getMessage()
                + " (left_col=" + leftColumns + ", right_col=" + rightColumns + ", how=" + kind.kindName() + ")", e);
        }
    }

    private static int[] keyIndexes(Relation r, List<String> columns, MissingJoinColumnException.Side side) {
        int[] idx = new int[columns.size()];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = r.indexOf(columns.get(i));
            if (idx[i] < 0) throw new MissingJoinColumnException(side, columns.get(i), r.columns());
        }
        return idx;
    }

    // State for one join call.
    private static final class Merge {
        private final Relation left;
        private final Relation right;
        private final int[] leftKeys;
        private final int[] rightKeys;
        private final JoinKind kind;
        // right column index -> left column index it collapses into, for same-named key pairs
        private final Map<Integer, Integer> collapsed = new HashMap<>();
        private final List<Integer> rightKept = new ArrayList<>();

        Merge(Relation left, Relation right, int[] leftKeys, int[] rightKeys, JoinKind kind) {
            this.left = left;
            this.right = right;
            this.leftKeys = leftKeys;
            this.rightKeys = rightKeys;
            this.kind = kind;
            for (int i = 0; i < leftKeys.length; i++) {
                if (left.columns().get(leftKeys[i]).equals(right.columns().get(rightKeys[i]))) {
                    collapsed.put(rightKeys[i], leftKeys[i]);
                }
            }
            for (int j = 0; j < right.columnCount(); j++) if (!collapsed.containsKey(j)) rightKept.add(j);
        }

        Relation run() {
            Relation.Builder out = new Relation.Builder(outputColumns());
            if (kind == JoinKind.RIGHT) {
                Map<List<Object>, List<Integer>> leftIndex = index(left, leftKeys);
                for (Record r : right.rows()) {
                    List<Integer> matches = lookup(leftIndex, r, rightKeys);
                    if (matches.isEmpty()) out.add(combine(null, r));
                    for (int li : matches) out.add(combine(left.rows().get(li), r));
                }
                return out.build();
            }
            Map<List<Object>, List<Integer>> rightIndex = index(right, rightKeys);
            Set<Integer> matchedRight = new HashSet<>();
            for (Record l : left.rows()) {
                List<Integer> matches = lookup(rightIndex, l, leftKeys);
                if (matches.isEmpty() && kind != JoinKind.INNER) out.add(combine(l, null));
                for (int ri : matches) {
                    matchedRight.add(ri);
                    out.add(combine(l, right.rows().get(ri)));
                }
            }
            if (kind == JoinKind.OUTER) {
                for (int ri = 0; ri < right.rowCount(); ri++) {
                    if (!matchedRight.contains(ri)) out.add(combine(null, right.rows().get(ri)));
                }
            }
            return out.build();
        }

        private List<String> outputColumns() {
            Set<String> leftNames = new HashSet<>(left.columns());
            Set<String> clash = new HashSet<>();
            for (int j : rightKept) {
                String name = right.columns().get(j);
                if (leftNames.contains(name)) clash.add(name);
            }
            List<String> names = new ArrayList<>(left.columnCount() + rightKept.size());
            for (String c : left.columns()) names.add(clash.contains(c) ? c + LEFT_SUFFIX : c);
            for (int j : rightKept) {
                String c = right.columns().get(j);
                names.add(clash.contains(c) ? c + RIGHT_SUFFIX : c);
            }
            return names;
        }

        // Either side may be null for unmatched rows; collapsed keys take the value of the side that exists.
        private List<Object> combine(Record l, Record r) {
            List<Object> values = new ArrayList<>(left.columnCount() + rightKept.size());
            if (l != null) {
                values.addAll(l.getValues());
            } else {
                values.addAll(Collections.nCopies(left.columnCount(), null));
                for (Map.Entry<Integer, Integer> e : collapsed.entrySet()) values.set(e.getValue(), r.get(e.getKey()));
            }
            for (int j : rightKept) values.add(r == null ? null : r.get(j));
            return values;
        }

        private static Map<List<Object>, List<Integer>> index(Relation rel, int[] keys) {
            Map<List<Object>, List<Integer>> idx = new HashMap<>();
            for (int i = 0; i < rel.rowCount(); i++) {
                List<Object> key = key(rel.rows().get(i), keys);
                if (key != null) idx.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
            return idx;
        }

        private static List<Integer> lookup(Map<List<Object>, List<Integer>> idx, Record row, int[] keys) {
            List<Object> key = key(row, keys);
            if (key == null) return List.of();
            return idx.getOrDefault(key, List.of());
        }

        // null when any key cell is null
        private static List<Object> key(Record row, int[] keys) {
            List<Object> key = new ArrayList<>(keys.length);
            for (int k : keys) {
                Object v = row.get(k);
                if (v == null) return null;
                key.add(Values.hashKey(v));
            }
            return key;
        }
    }
}
