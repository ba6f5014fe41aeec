package etl.engine.exec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import etl.engine.data.Values;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.AggregateFunction;

/**
 * Computes aggregation functions over the cells of one column of one group.
 * Nulls are skipped by every function except size.
 */
public final class Aggregator {
    private Aggregator() {}

    /** function(*): only the counting functions get here. */
    public static Object applyWildcard(AggregateFunction fn, int rowCount) {
        if (!fn.acceptsWildcard()) throw new IllegalArgumentException(fn.sqlName() + " cannot be applied to *");
        return (long) rowCount;
    }

    public static Object apply(AggregateFunction fn, List<Object> cells, String column) {
        List<Object> present = new ArrayList<>(cells.size());
        for (Object c : cells) if (c != null) present.add(c);
        if (fn.numeric()) {
            for (Object v : present) {
                if (!Values.isNumeric(v)) {
                    throw new QueryException(ErrorKind.INVALID_AGGREGATION,
                        fn.sqlName() + "(" + column + ") needs numeric values but found " + Values.typeName(v) + " '" + v + "'");
                }
            }
        }
        return switch (fn) {
            case SUM -> sum(present);
            case PROD -> prod(present);
            case MEAN -> present.isEmpty() ? null : sumAsDouble(present) / present.size();
            case MEDIAN -> median(present);
            case VAR -> variance(present);
            case STD -> {
                Double var = variance(present);
                yield var == null ? null : Math.sqrt(var);
            }
            case MIN -> extreme(present, -1);
            case MAX -> extreme(present, 1);
            case COUNT -> (long) present.size();
            case SIZE -> (long) cells.size();
            case NUNIQUE -> {
                Set<Object> distinct = new HashSet<>();
                for (Object v : present) distinct.add(Values.hashKey(v));
                yield (long) distinct.size();
            }
            case FIRST -> present.isEmpty() ? null : present.get(0);
            case LAST -> present.isEmpty() ? null : present.get(present.size() - 1);
        };
    }

    private static Object sum(List<Object> values) {
        long acc = 0;
        for (Object v : values) {
            if (!(v instanceof Long l)) return sumAsDouble(values);
            try {
                acc = Math.addExact(acc, l);
            } catch (ArithmeticException overflow) {
                return sumAsDouble(values);
            }
        }
        return acc;
    }

    private static Object prod(List<Object> values) {
        long acc = 1;
        for (Object v : values) {
            if (!(v instanceof Long l)) return prodAsDouble(values);
            try {
                acc = Math.multiplyExact(acc, l);
            } catch (ArithmeticException overflow) {
                return prodAsDouble(values);
            }
        }
        return acc;
    }

    private static double sumAsDouble(List<Object> values) {
        double acc = 0;
        for (Object v : values) acc += ((Number) v).doubleValue();
        return acc;
    }

    private static double prodAsDouble(List<Object> values) {
        double acc = 1;
        for (Object v : values) acc *= ((Number) v).doubleValue();
        return acc;
    }

    private static Double median(List<Object> values) {
        if (values.isEmpty()) return null;
        double[] sorted = new double[values.size()];
        for (int i = 0; i < sorted.length; i++) sorted[i] = ((Number) values.get(i)).doubleValue();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    // sample variance (n - 1 denominator)
    private static Double variance(List<Object> values) {
        int n = values.size();
        if (n < 2) return null;
        double mean = sumAsDouble(values) / n;
        double acc = 0;
        for (Object v : values) {
            double d = ((Number) v).doubleValue() - mean;
            acc += d * d;
        }
        return acc / (n - 1);
    }

    private static Object extreme(List<Object> values, int sign) {
        Object best = null;
        for (Object v : values) {
            if (best == null || Integer.signum(Values.compare(v, best)) == sign) best = v;
        }
        return best;
    }
}
