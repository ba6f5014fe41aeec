package etl.engine.query.ast;

import java.util.Locale;
import java.util.Map;
import java.util.HashMap;

/**
 * Aggregation functions understood by the grammar. Numeric functions reject
 * non-numeric cells at execution time.
 */
public enum AggregateFunction {
    SUM("sum", true),
    MEAN("mean", true),
    MEDIAN("median", true),
    MIN("min", false),
    MAX("max", false),
    COUNT("count", false),
    SIZE("size", false),
    NUNIQUE("nunique", false),
    STD("std", true),
    VAR("var", true),
    FIRST("first", false),
    LAST("last", false),
    PROD("prod", true);

    private static final Map<String, AggregateFunction> BY_NAME = new HashMap<>();
    static {
        for (AggregateFunction f : values()) BY_NAME.put(f.sqlName, f);
        BY_NAME.put("avg", MEAN);
    }

    private final String sqlName;
    private final boolean numeric;

    AggregateFunction(String sqlName, boolean numeric) {
        this.sqlName = sqlName;
        this.numeric = numeric;
    }

    public String sqlName() { return sqlName; }
    public boolean numeric() { return numeric; }

    /** Only size may be applied to *. */
    public boolean acceptsWildcard() {
        return this == SIZE;
    }

    public static boolean isFunctionName(String name) {
        return BY_NAME.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public static AggregateFunction fromName(String name) {
        AggregateFunction f = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (f == null) throw new IllegalArgumentException("Unknown aggregation function: " + name);
        return f;
    }
}
