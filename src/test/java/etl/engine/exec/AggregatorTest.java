package etl.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.AggregateFunction;

public class AggregatorTest {

    private static Object agg(AggregateFunction fn, Object... cells) {
        return Aggregator.apply(fn, Arrays.asList(cells), "c");
    }

    @Test
    void integerSumsStayIntegral() {
        assertEquals(6L, agg(AggregateFunction.SUM, 1L, 2L, 3L));
        assertEquals(3.5d, agg(AggregateFunction.SUM, 1L, 2.5d));
        assertEquals(24L, agg(AggregateFunction.PROD, 2L, 3L, 4L));
    }

    @Test
    void overflowFallsBackToDouble() {
        Object sum = agg(AggregateFunction.SUM, Long.MAX_VALUE, 1L);
        assertTrue(sum instanceof Double);
    }

    @Test
    void statisticsSkipNulls() {
        assertEquals(2.0d, agg(AggregateFunction.MEAN, 1L, null, 3L));
        assertEquals(2.5d, agg(AggregateFunction.MEDIAN, 4L, 1L, 2L, 3L));
        assertEquals(1.0d, agg(AggregateFunction.VAR, 1L, 2L, 3L));
        assertEquals(1.0d, (Double) agg(AggregateFunction.STD, 1L, 2L, 3L), 1e-9);
        assertNull(agg(AggregateFunction.VAR, 5L));
    }

    @Test
    void countingFunctions() {
        assertEquals(2L, agg(AggregateFunction.COUNT, "a", null, "b"));
        assertEquals(3L, agg(AggregateFunction.SIZE, "a", null, "b"));
        assertEquals(2L, agg(AggregateFunction.NUNIQUE, 1L, 1.0d, 2L));
        assertEquals(4L, Aggregator.applyWildcard(AggregateFunction.SIZE, 4));
    }

    @Test
    void orderFunctionsWorkOnStrings() {
        assertEquals("apple", agg(AggregateFunction.MIN, "pear", "apple", null));
        assertEquals("pear", agg(AggregateFunction.MAX, "pear", "apple"));
        assertEquals("pear", agg(AggregateFunction.FIRST, null, "pear", "apple"));
        assertEquals("apple", agg(AggregateFunction.LAST, "pear", "apple", null));
    }

    @Test
    void emptyInputDefaults() {
        List<Object> none = List.of();
        assertEquals(0L, Aggregator.apply(AggregateFunction.SUM, none, "c"));
        assertEquals(1L, Aggregator.apply(AggregateFunction.PROD, none, "c"));
        assertEquals(0L, Aggregator.apply(AggregateFunction.COUNT, none, "c"));
        assertNull(Aggregator.apply(AggregateFunction.MEAN, none, "c"));
        assertNull(Aggregator.apply(AggregateFunction.MIN, none, "c"));
    }

    @Test
    void numericFunctionsRejectText() {
        QueryException ex = assertThrows(QueryException.class, () -> agg(AggregateFunction.SUM, 1L, "x"));
        assertEquals(ErrorKind.INVALID_AGGREGATION, ex.kind());
        assertTrue(ex.getMessage().contains("sum(c)"));
    }

    @Test
    void functionNamesResolveCaseInsensitively() {
        assertEquals(AggregateFunction.MEAN, AggregateFunction.fromName("AVG"));
        assertTrue(AggregateFunction.isFunctionName("NUnique"));
        assertFalse(AggregateFunction.isFunctionName("total"));
    }
}
