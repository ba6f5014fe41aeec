package etl.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.source.MemorySource;
import etl.engine.source.SourceRegistry;

public class QueryProcessorTest {

    @TempDir
    Path dataDir;

    private MemorySource memory;
    private QueryProcessor qp;

    @BeforeEach
    void setUp() {
        memory = new MemorySource();
        qp = new QueryProcessor(SourceRegistry.withDefaults(dataDir, ',', memory));
        memory.put("sales", new Relation.Builder(List.of("region", "amount"))
            .add(Record.of("east", 10))
            .add(Record.of("west", 5))
            .add(Record.of("east", 20))
            .build());
        memory.put("orders", new Relation.Builder(List.of("id", "cust_id", "item_id"))
            .add(Record.of(1, 10, 100))
            .add(Record.of(2, 11, 101))
            .add(Record.of(3, 10, 102))
            .build());
        memory.put("customers", new Relation.Builder(List.of("id", "name"))
            .add(Record.of(10, "Ann"))
            .add(Record.of(11, "Ben"))
            .build());
        memory.put("items", new Relation.Builder(List.of("id", "title"))
            .add(Record.of(100, "pen"))
            .add(Record.of(101, "ink"))
            .build());
    }

    @Test
    void groupedSumKeepsFirstSeenRegionOrder() {
        Relation out = qp.execute("SELECT region, sum(amount) FROM {memory:sales} GROUP BY region;");
        assertEquals(List.of(Record.of("east", 30), Record.of("west", 5)), out.rows());
    }

    @Test
    void orderByDescendingWithLimit() {
        Relation out = qp.execute("SELECT * FROM {memory:sales} ORDER BY amount DESC LIMIT 2;");
        assertEquals(List.of(Record.of("east", 20), Record.of("east", 10)), out.rows());
    }

    @Test
    void filteredSumIsOneRow() {
        Relation out = qp.execute("SELECT sum(amount) FROM {memory:sales} WHERE region = 'east';");
        assertEquals(List.of(Record.of(30)), out.rows());
    }

    @Test
    void nonKeyColumnInGroupedSelectFails() {
        QueryException ex = assertThrows(QueryException.class,
            () -> qp.execute("SELECT region FROM {memory:sales} GROUP BY amount;"));
        assertEquals(ErrorKind.COLUMN_NOT_IN_GROUP_BY, ex.kind());
    }

    @Test
    void leftJoinWithEmptyRightCopiesLeft() {
        memory.put("nobody", Relation.empty(List.of("id", "name")));
        Relation out = qp.execute("SELECT * FROM {memory:orders} LEFT JOIN {memory:nobody} ON cust_id = id;");
        assertEquals(memory.get("orders").orElseThrow(), out);
    }

    @Test
    void multiWayJoinFollowsAliasesThroughRenames() {
        Relation out = qp.execute("SELECT o.id, c.name, i.title FROM {memory:orders} AS o "
            + "JOIN {memory:customers} AS c ON o.cust_id = c.id "
            + "JOIN {memory:items} AS i ON i.id = o.item_id;");
        assertEquals(List.of("id_left", "name", "title"), out.columns());
        assertEquals(List.of(Record.of(1, "Ann", "pen"), Record.of(2, "Ben", "ink")), out.rows());
    }

    @Test
    void compositeJoinKeys() {
        memory.put("prices", new Relation.Builder(List.of("region", "amount", "tier"))
            .add(Record.of("east", 20, "gold"))
            .add(Record.of("west", 20, "silver"))
            .build());
        Relation out = qp.execute("SELECT s.region, p.tier FROM {memory:sales} AS s "
            + "JOIN {memory:prices} AS p ON s.region = p.region AND p.amount = s.amount;");
        assertEquals(List.of(Record.of("east", "gold")), out.rows());
    }

    @Test
    void orInJoinIsRejected() {
        QueryException ex = assertThrows(QueryException.class,
            () -> qp.execute("SELECT * FROM {memory:orders} AS o JOIN {memory:customers} AS c "
                + "ON o.cust_id = c.id OR o.id = c.id;"));
        assertEquals(ErrorKind.UNSUPPORTED_JOIN_CONDITION, ex.kind());
    }

    @Test
    void missingJoinColumnIsReported() {
        QueryException ex = assertThrows(QueryException.class,
            () -> qp.execute("SELECT * FROM {memory:orders} JOIN {memory:customers} ON customer = id;"));
        assertEquals(ErrorKind.MISSING_JOIN_COLUMN, ex.kind());
    }

    @Test
    void selectIntoWritesSinkAndReturnsResult() throws IOException {
        Relation out = qp.execute("SELECT region, sum(amount) INTO {csv:out/totals.csv} FROM {memory:sales} GROUP BY region;");
        assertEquals(2, out.rowCount());
        assertTrue(Files.exists(dataDir.resolve("out/totals.csv")));

        Relation reread = qp.execute("SELECT * FROM {csv:out/totals.csv};");
        assertEquals(out, reread);
    }

    @Test
    void csvFileIsQueried() throws IOException {
        Files.writeString(dataDir.resolve("people.csv"), "name,age\nAlice,30\n\"Smith, Bob\",17\n");
        Relation out = qp.execute("SELECT name FROM {csv:people.csv} WHERE age < 18;");
        assertEquals(List.of(Record.of("Smith, Bob")), out.rows());
    }

    @Test
    void csvColumnWithMixedCodesIsQueriedAsText() throws IOException {
        Files.writeString(dataDir.resolve("codes.csv"), "code,qty\nA12,1\n007,2\nB3,3\n");
        Relation sorted = qp.execute("SELECT * FROM {csv:codes.csv} ORDER BY code;");
        assertEquals(List.of(Record.of("007", 2), Record.of("A12", 1), Record.of("B3", 3)), sorted.rows());

        Relation match = qp.execute("SELECT qty FROM {csv:codes.csv} WHERE code = '007';");
        assertEquals(List.of(Record.of(2)), match.rows());
    }

    @Test
    void insertHandsLiteralRowsToLoader() {
        Relation diag = qp.execute("INSERT INTO {memory:staged} VALUES (1, 'a'), (2, 'b');");
        assertEquals(List.of("statement", "rows"), diag.columns());
        assertEquals(Record.of("INSERT", 2), diag.rows().get(0));

        Relation staged = memory.get("staged").orElseThrow();
        assertEquals(List.of("c0", "c1"), staged.columns());
        assertEquals(Record.of(2, "b"), staged.rows().get(1));

        qp.execute("INSERT INTO {memory:named} (id, label) VALUES (7, 'x');");
        assertEquals(List.of("id", "label"), memory.get("named").orElseThrow().columns());
    }

    @Test
    void updateAndDeleteAreNotExecuted() {
        QueryException up = assertThrows(QueryException.class,
            () -> qp.execute("UPDATE {memory:sales} SET amount = 0;"));
        assertEquals(ErrorKind.UNSUPPORTED_STATEMENT, up.kind());
        QueryException del = assertThrows(QueryException.class,
            () -> qp.execute("DELETE FROM {memory:sales} WHERE amount > 1;"));
        assertEquals(ErrorKind.UNSUPPORTED_STATEMENT, del.kind());
        assertEquals(3, memory.get("sales").orElseThrow().rowCount());
    }

    @Test
    void unknownSourceTypeIsSurfacedUnchanged() {
        QueryException ex = assertThrows(QueryException.class,
            () -> qp.execute("SELECT * FROM {xls:report.xls};"));
        assertEquals(ErrorKind.UNKNOWN_SOURCE_TYPE, ex.kind());
    }

    @Test
    void adapterFailureIsWrappedWithDatasource() {
        QueryException ex = assertThrows(QueryException.class,
            () -> qp.execute("SELECT * FROM {csv:missing.csv};"));
        assertEquals(ErrorKind.EXTRACT_FAILED, ex.kind());
        assertTrue(ex.getMessage().contains("csv:missing.csv"));
        assertNotNull(ex.getCause());
    }

    @Test
    void repeatedExecutionIsIndependent() {
        String sql = "SELECT region, size(*) FROM {memory:sales} GROUP BY region ORDER BY size(*) DESC;";
        Relation first = qp.execute(sql);
        qp.execute("SELECT * FROM {memory:orders};");
        assertEquals(first, qp.execute(sql));
        assertEquals(Record.of("east", 2), first.rows().get(0));
    }

    @Test
    void planIsExposedWithoutRunning() {
        assertEquals(3, qp.plan("SELECT * INTO {csv:x.csv} FROM {csv:never-read.csv};").steps().size());
    }
}
