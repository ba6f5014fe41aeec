package etl.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

import etl.engine.error.ErrorKind;
import etl.engine.error.SyntaxException;
import etl.engine.query.ast.AggregateFunction;
import etl.engine.query.ast.Aggregation;
import etl.engine.query.ast.ColumnIndex;
import etl.engine.query.ast.ColumnName;
import etl.engine.query.ast.Comparison;
import etl.engine.query.ast.ComparisonOp;
import etl.engine.query.ast.Datasource;
import etl.engine.query.ast.DeleteStatement;
import etl.engine.query.ast.InsertStatement;
import etl.engine.query.ast.JoinEquality;
import etl.engine.query.ast.JoinType;
import etl.engine.query.ast.LimitClause;
import etl.engine.query.ast.Literal;
import etl.engine.query.ast.Logical;
import etl.engine.query.ast.LogicalOp;
import etl.engine.query.ast.Not;
import etl.engine.query.ast.OrderByParameter;
import etl.engine.query.ast.QualifiedColumn;
import etl.engine.query.ast.SelectStatement;
import etl.engine.query.ast.SortDirection;
import etl.engine.query.ast.UpdateStatement;

public class QueryParserTest {

    private final QueryParser parser = new QueryParser();

    @Test
    void parsesFullSelect() {
        SelectStatement s = parser.parseSelect(
            "SELECT DISTINCT region, sum(amount) INTO {csv:out.csv} FROM {csv:sales.csv} AS s "
                + "WHERE amount > 5 AND NOT region = 'north' GROUP BY region ORDER BY region DESC TAIL 3;");
        assertTrue(s.distinct());
        assertEquals(List.of(new ColumnName("region"), new Aggregation(AggregateFunction.SUM, new ColumnName("amount"))),
            s.columns().items());
        assertEquals(Datasource.of("csv", "out.csv"), s.into());
        assertEquals("s", s.source().alias());
        assertEquals(new Logical(LogicalOp.AND,
            new Comparison(new ColumnName("amount"), ComparisonOp.GT, new Literal(5L)),
            new Not(new Comparison(new ColumnName("region"), ComparisonOp.EQ, new Literal("north")))), s.where());
        assertEquals(List.of(new ColumnName("region")), s.groupBy());
        assertEquals(List.of(new OrderByParameter(new ColumnName("region"), SortDirection.DESC)), s.orderBy().parameters());
        assertEquals(new LimitClause(LimitClause.Kind.TAIL, 3), s.limit());
    }

    @Test
    void parsingIsDeterministic() {
        String sql = "SELECT a.x, #1 FROM {csv:a.csv} AS a LEFT OUTER JOIN {json:b.json} AS b ON a.id = b.id;";
        assertEquals(parser.parse(sql), parser.parse(sql));
    }

    @Test
    void joinKindsAndQualifiers() {
        SelectStatement s = parser.parseSelect("SELECT * FROM {csv:a} AS a JOIN {csv:b} AS b ON a.id = b.id "
            + "RIGHT JOIN {csv:c} AS c ON c.k = a.k FULL OUTER JOIN {csv:d} AS d ON d.k = a.k AND d.j = a.j;");
        assertEquals(List.of(JoinType.INNER, JoinType.RIGHT, JoinType.OUTER),
            s.joins().stream().map(j -> j.type()).toList());
        assertEquals(new QualifiedColumn("c", "k"), ((JoinEquality) s.joins().get(1).on()).left());
    }

    @Test
    void bracketedNamesAndIndexes() {
        SelectStatement s = parser.parseSelect("SELECT [Total Sales*], #0, t.[unit price] FROM {csv:t} AS t ORDER BY [Total Sales*];");
        // markers are kept verbatim; resolution decides whether to drop them
        assertEquals(new ColumnName("Total Sales*"), s.columns().items().get(0));
        assertEquals(new ColumnIndex(0), s.columns().items().get(1));
        assertEquals(new QualifiedColumn("t", "unit price"), s.columns().items().get(2));
        assertEquals(new ColumnName("Total Sales*"), s.orderBy().parameters().get(0).parameter());
    }

    @Test
    void wildcardOnlyForSize() {
        assertTrue(((Aggregation) parser.parseSelect("SELECT size(*) FROM {csv:t};").columns().items().get(0)).isWildcard());
        SyntaxException ex = assertThrows(SyntaxException.class,
            () -> parser.parse("SELECT sum(*) FROM {csv:t};"));
        assertEquals(ErrorKind.AGGREGATION_ON_WILDCARD_DISALLOWED, ex.kind());
        assertEquals("*", ex.token());

        SyntaxException count = assertThrows(SyntaxException.class,
            () -> parser.parse("SELECT count(*) FROM {csv:t};"));
        assertEquals(ErrorKind.AGGREGATION_ON_WILDCARD_DISALLOWED, count.kind());
    }

    @Test
    void syntaxErrorsCarryTokenAndPosition() {
        SyntaxException ex = assertThrows(SyntaxException.class,
            () -> parser.parse("SELECT a\nFROM WHERE;"));
        assertEquals(ErrorKind.SYNTAX_ERROR, ex.kind());
        assertEquals("WHERE", ex.token());
        assertEquals(2, ex.line());
        assertEquals(6, ex.column());
    }

    @Test
    void missingTerminatorAndTrailingInputFail() {
        assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM {csv:t}"));
        assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM {csv:t}; SELECT"));
    }

    @Test
    void datasourceNeedsTypeAndPath() {
        assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM {sales.csv};"));
        assertThrows(SyntaxException.class, () -> parser.parse("SELECT * FROM {csv:};"));
    }

    @Test
    void remoteDescriptorIsParsed() {
        SelectStatement s = parser.parseSelect(
            "SELECT * FROM {gee:my-proj|MODIS/061/MOD13Q1|2020-01-01|2020-12-31|-47.9|-15.8|250};");
        Datasource ds = s.source().datasource();
        assertEquals("gee", ds.sourceType());
        assertEquals(LocalDate.of(2020, 12, 31), ds.remote().endDate());
        assertEquals(-47.9d, ds.remote().longitude());

        assertThrows(SyntaxException.class,
            () -> parser.parse("SELECT * FROM {gee:p|d|2020-13-01|2020-12-31|1|2|3};"));
    }

    @Test
    void insertUpdateDelete() {
        InsertStatement ins = (InsertStatement) parser.parse(
            "INSERT INTO {csv:t.csv} (id, name) VALUES (1, 'a'), (2, 'b');");
        assertEquals(2, ins.rows().size());
        assertEquals(List.of(2L, "b"), ins.rows().get(1));

        assertThrows(SyntaxException.class,
            () -> parser.parse("INSERT INTO {csv:t.csv} (id, name) VALUES (1);"));

        UpdateStatement up = (UpdateStatement) parser.parse("UPDATE {csv:t.csv} SET name = 'z' WHERE id = 1;");
        assertEquals(1, up.assignments().size());
        DeleteStatement del = (DeleteStatement) parser.parse("DELETE FROM {csv:t.csv};");
        assertNull(del.where());
    }

    @Test
    void aggregationNameCanBeAColumn() {
        SelectStatement s = parser.parseSelect("SELECT count, max(count) FROM {csv:t} GROUP BY count;");
        assertEquals(new ColumnName("count"), s.columns().items().get(0));
    }
}
