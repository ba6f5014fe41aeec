package etl.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.MissingJoinColumnException;
import etl.engine.error.QueryException;

public class JoinOperatorTest {

    private static Relation students() {
        // duplicate id=2 on purpose
        return new Relation.Builder(List.of("id", "name", "active"))
            .add(Record.of(1, "Alice", true))
            .add(Record.of(2, "Bob", false))
            .add(Record.of(2, "Bobby", true))
            .add(Record.of(3, "Eve", true))
            .add(Record.of(4, "Dave", false))
            .build();
    }

    private static Relation enrollments() {
        return new Relation.Builder(List.of("id", "student_id", "course"))
            .add(Record.of(100, 1, "Math"))
            .add(Record.of(101, 1, "Physics"))
            .add(Record.of(102, 2, "Chemistry"))
            .add(Record.of(103, 2, "Biology"))
            .add(Record.of(104, 3, "Math"))
            .add(Record.of(105, 9, "Art"))
            .build();
    }

    @Test
    void innerJoinProducesExpectedCombinedRows() {
        Relation out = JoinOperator.join(students(), enrollments(), "id", "student_id", "inner");
        // id=1 has 2, id=2 has 2 for each of two students, id=3 has 1 => 7 rows
        assertEquals(7, out.rowCount());
        assertEquals(List.of("id_left", "name", "active", "id_right", "student_id", "course"), out.columns());
        assertEquals(Record.of(1, "Alice", true, 100, 1, "Math"), out.rows().get(0));
        assertEquals(Record.of(1, "Alice", true, 101, 1, "Physics"), out.rows().get(1));
    }

    @Test
    void leftJoinKeepsUnmatchedLeftRowsWithNulls() {
        Relation out = JoinOperator.join(students(), enrollments(), "id", "student_id", "left");
        assertEquals(8, out.rowCount());
        Record dave = out.rows().get(7);
        assertEquals(Arrays.asList(4L, "Dave", false, null, null, null), dave.getValues());
    }

    @Test
    void rightJoinFollowsRightOrder() {
        Relation out = JoinOperator.join(students(), enrollments(), "id", "student_id", "RIGHT");
        assertEquals(8, out.rowCount());
        assertEquals(100L, out.rows().get(0).get(3));
        Record art = out.rows().get(7);
        assertEquals(Arrays.asList(null, null, null, 105L, 9L, "Art"), art.getValues());
    }

    @Test
    void outerJoinAppendsUnmatchedRightRows() {
        Relation out = JoinOperator.join(students(), enrollments(), "id", "student_id", "outer");
        assertEquals(9, out.rowCount());
        assertEquals("Dave", out.rows().get(7).get(1));
        assertEquals("Art", out.rows().get(8).get(5));
    }

    @Test
    void sameNamedKeysCollapseIntoOneColumn() {
        Relation left = new Relation.Builder(List.of("id", "x")).add(Record.of(1, "a")).add(Record.of(2, "b")).build();
        Relation right = new Relation.Builder(List.of("id", "y")).add(Record.of(2, "c")).add(Record.of(3, "d")).build();
        Relation out = JoinOperator.join(left, right, "id", "id", JoinKind.OUTER);
        assertEquals(List.of("id", "x", "y"), out.columns());
        assertEquals(Arrays.asList(1L, "a", null), out.rows().get(0).getValues());
        assertEquals(Arrays.asList(2L, "b", "c"), out.rows().get(1).getValues());
        assertEquals(Arrays.asList(3L, null, "d"), out.rows().get(2).getValues());
    }

    @Test
    void nullKeysNeverMatchAndNumericKeysMatchAcrossTypes() {
        Relation left = new Relation.Builder(List.of("k", "l"))
            .add(Arrays.asList(null, "n"))
            .add(Record.of(1, "one"))
            .build();
        Relation right = new Relation.Builder(List.of("k2", "r"))
            .add(Arrays.asList(null, "rn"))
            .add(Record.of(1.0, "uno"))
            .build();
        Relation out = JoinOperator.join(left, right, "k", "k2", "inner");
        assertEquals(1, out.rowCount());
        assertEquals("uno", out.rows().get(0).get(3));
    }

    @Test
    void compositeKeysRequireEveryPairToMatch() {
        Relation left = new Relation.Builder(List.of("a", "b")).add(Record.of(1, "x")).add(Record.of(1, "y")).build();
        Relation right = new Relation.Builder(List.of("c", "d")).add(Record.of(1, "y")).build();
        Relation out = JoinOperator.join(left, right, List.of("a", "b"), List.of("c", "d"), JoinKind.INNER);
        assertEquals(1, out.rowCount());
        assertEquals(Record.of(1, "y", 1, "y"), out.rows().get(0));
    }

    @Test
    void emptyInputsShortCircuit() {
        Relation empty = Relation.empty(List.of("student_id"));
        assertEquals(Relation.empty(), JoinOperator.join(empty, Relation.empty(), "x", "y", "outer"));
        assertTrue(JoinOperator.join(empty, enrollments(), "id", "student_id", "left").isEmpty());
        assertEquals(enrollments(), JoinOperator.join(empty, enrollments(), "id", "student_id", "right"));
        assertEquals(students(), JoinOperator.join(students(), empty, "id", "student_id", "left"));
        assertTrue(JoinOperator.join(students(), empty, "id", "student_id", "inner").isEmpty());
    }

    @Test
    void invalidKindIsRejected() {
        QueryException ex = assertThrows(QueryException.class,
            () -> JoinOperator.join(students(), enrollments(), "id", "student_id", "cross"));
        assertEquals(ErrorKind.INVALID_JOIN_KIND, ex.kind());
    }

    @Test
    void missingKeyColumnReportsSide() {
        MissingJoinColumnException ex = assertThrows(MissingJoinColumnException.class,
            () -> JoinOperator.join(students(), enrollments(), "id", "nope", "inner"));
        assertEquals(MissingJoinColumnException.Side.RIGHT, ex.side());
        assertEquals("nope", ex.column());
        assertEquals(enrollments().columns(), ex.available());
        assertEquals(ErrorKind.MISSING_JOIN_COLUMN, ex.kind());
    }

    @Test
    void nullInputIsRejected() {
        QueryException ex = assertThrows(QueryException.class,
            () -> JoinOperator.join(null, enrollments(), "id", "student_id", "inner"));
        assertEquals(ErrorKind.NULL_INPUT, ex.kind());
    }

    @Test
    void remainingNameClashIsReportedAsJoinFailure() {
        Relation left = new Relation.Builder(List.of("k", "v", "v_left")).add(Record.of(1, "a", "b")).build();
        Relation right = new Relation.Builder(List.of("k2", "v")).add(Record.of(1, "c")).build();
        QueryException ex = assertThrows(QueryException.class,
            () -> JoinOperator.join(left, right, "k", "k2", "inner"));
        assertEquals(ErrorKind.JOIN_FAILED, ex.kind());
        assertTrue(ex.getMessage().contains("how=inner"));
    }
}
