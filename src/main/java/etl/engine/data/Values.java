package etl.engine.data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;

/**
 * Helpers for the dynamically typed cell values carried by relations.
 * Cells are String, Long, Double, Boolean or null; other numeric boxes are
 * normalized on entry.
 */
public final class Values {
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    /** Ascending order with nulls first; callers place nulls themselves. */
    public static final Comparator<Object> NATURAL_ORDER = Values::compare;

    private Values() {}

    public static Object normalize(Object v) {
        if (v == null || v instanceof Long || v instanceof Double || v instanceof String || v instanceof Boolean) return v;
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
        if (v instanceof BigInteger bi) return bi.longValue();
        if (v instanceof Float || v instanceof BigDecimal) return ((Number) v).doubleValue();
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof Character c) return c.toString();
        return v.toString();
    }

    public static boolean isNumeric(Object v) {
        return v instanceof Long || v instanceof Double;
    }

    /**
     * Total order over comparable cells. Numbers compare numerically across
     * Long/Double, strings lexicographically, booleans false before true.
     * Nulls sort before everything. Mixing kinds fails with TYPE_MISMATCH.
     */
    public static int compare(Object a, Object b) {
        if (a == null || b == null) {
            if (a == b) return 0;
            return a == null ? -1 : 1;
        }
        if (a instanceof Long la && b instanceof Long lb) return Long.compare(la, lb);
        if (isNumeric(a) && isNumeric(b)) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof String sa && b instanceof String sb) return sa.compareTo(sb);
        if (a instanceof Boolean ba && b instanceof Boolean bb) return Boolean.compare(ba, bb);
        throw new QueryException(ErrorKind.TYPE_MISMATCH,
            "Cannot compare " + typeName(a) + " '" + a + "' with " + typeName(b) + " '" + b + "'");
    }

    /** Equality as used by WHERE and join keys: numerically across Long/Double, false across kinds. */
    public static boolean looselyEquals(Object a, Object b) {
        if (a == null || b == null) return false;
        if (isNumeric(a) && isNumeric(b)) {
            if (a instanceof Long la && b instanceof Long lb) return la.longValue() == lb.longValue();
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return a.equals(b);
    }

    /**
     * Canonical form for hashing so that 1 and 1.0 land in the same bucket.
     */
    public static Object hashKey(Object v) {
        if (v instanceof Double d && !d.isInfinite() && !d.isNaN() && d == Math.rint(d)
                && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
            return d.longValue();
        }
        return v;
    }

    /**
     * Infer one type for a whole column of raw text cells. The column becomes
     * integers, then floats, then booleans, only when every non-empty cell
     * parses as that type; otherwise every cell stays a string. Empty text is
     * null in every case.
     */
    public static List<Object> parseColumn(List<String> raw) {
        List<Object> out = new ArrayList<>(raw.size());
        if (all(raw, Values::isLong)) {
            for (String s : raw) out.add(blank(s) ? null : Long.parseLong(s));
        } else if (all(raw, s -> DECIMAL.matcher(s).matches())) {
            for (String s : raw) out.add(blank(s) ? null : Double.parseDouble(s));
        } else if (all(raw, s -> s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            for (String s : raw) out.add(blank(s) ? null : Boolean.valueOf(s.equalsIgnoreCase("true")));
        } else {
            for (String s : raw) out.add(blank(s) ? null : s);
        }
        return out;
    }

    private static boolean all(List<String> raw, Predicate<String> test) {
        boolean seen = false;
        for (String s : raw) {
            if (blank(s)) continue;
            if (!test.test(s)) return false;
            seen = true;
        }
        return seen;
    }

    private static boolean blank(String s) {
        return s == null || s.isEmpty();
    }

    private static boolean isLong(String s) {
        if (!INTEGER.matcher(s).matches()) return false;
        try {
            Long.parseLong(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static String typeName(Object v) {
        if (v == null) return "null";
        if (v instanceof Long) return "integer";
        if (v instanceof Double) return "float";
        if (v instanceof Boolean) return "boolean";
        if (v instanceof String) return "string";
        return v.getClass().getSimpleName();
    }
}
