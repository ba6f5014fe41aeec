package etl.engine.exec;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks, per table alias, where each source column ended up in the current
 * relation. A join can rename a column (x to x_left), so alias.x has to
 * follow the rename. Immutable; joins produce new bindings.
 */
public final class AliasBindings {
    private static final AliasBindings NONE = new AliasBindings(Map.of());

    private final Map<String, Map<String, String>> byAlias;

    private AliasBindings(Map<String, Map<String, String>> byAlias) {
        this.byAlias = byAlias;
    }

    public static AliasBindings none() {
        return NONE;
    }

    /** Bindings for a freshly extracted relation: every column maps to itself. */
    public static AliasBindings forSource(String alias, List<String> columns) {
        if (alias == null) return NONE;
        Map<String, String> identity = new LinkedHashMap<>();
        for (String c : columns) identity.put(c, c);
        return new AliasBindings(Map.of(alias, Collections.unmodifiableMap(identity)));
    }

    public boolean isBound(String alias) {
        return byAlias.containsKey(alias);
    }

    /** Current column name for alias.column, or null if the alias lost it. */
    public String lookup(String alias, String column) {
        Map<String, String> m = byAlias.get(alias);
        return m == null ? null : m.get(column);
    }

    /**
     * Bindings after a join: the columns of both sides are re-pointed to their
     * names in the joined output: the plain name if it survived, otherwise
     * the side suffix. Columns missing from the output are dropped.
     */
    public static AliasBindings afterJoin(AliasBindings left, AliasBindings right, List<String> output) {
        Map<String, Map<String, String>> merged = new HashMap<>();
        remap(left, JoinOperator.LEFT_SUFFIX, output, merged);
        remap(right, JoinOperator.RIGHT_SUFFIX, output, merged);
        return new AliasBindings(Collections.unmodifiableMap(merged));
    }

    private static void remap(AliasBindings side, String suffix, List<String> output, Map<String, Map<String, String>> into) {
        for (Map.Entry<String, Map<String, String>> e : side.byAlias.entrySet()) {
            Map<String, String> moved = new LinkedHashMap<>();
            for (Map.Entry<String, String> col : e.getValue().entrySet()) {
                String current = col.getValue();
                if (output.contains(current)) moved.put(col.getKey(), current);
                else if (output.contains(current + suffix)) moved.put(col.getKey(), current + suffix);
            }
            into.put(e.getKey(), Collections.unmodifiableMap(moved));
        }
    }

    @Override
    public String toString() {
        return "AliasBindings" + byAlias;
    }
}
