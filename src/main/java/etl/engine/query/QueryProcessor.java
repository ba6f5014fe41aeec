package etl.engine.query;

import java.util.ArrayList;
import java.util.List;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.data.Values;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.DeleteStatement;
import etl.engine.query.ast.InsertStatement;
import etl.engine.query.ast.SelectStatement;
import etl.engine.query.ast.Statement;
import etl.engine.query.ast.UpdateStatement;
import etl.engine.query.plan.ExecutionPlan;
import etl.engine.source.SourceRegistry;

/**
 * Processor combining parsing, planning and execution.
 */
public class QueryProcessor {
    private static final List<String> DIAGNOSTIC_COLUMNS = List.of("statement", "rows");

    private final QueryParser parser = new QueryParser();
    private final QueryPlanner planner = new QueryPlanner();
    private final QueryExecutor executor;

    public QueryProcessor(SourceRegistry sources) {
        this.executor = new QueryExecutor(sources);
    }

    /** Parses and plans a SELECT without running it. */
    public ExecutionPlan plan(String sql) {
        return planner.plan(parser.parseSelect(sql));
    }

    /**
     * Unified execution entry point.
     * SELECT -> the transformed relation (also loaded to the INTO sink when given).
     * INSERT -> single diagnostic row: ["INSERT", rowCount].
     * UPDATE / DELETE -> UNSUPPORTED_STATEMENT.
     */
    public Relation execute(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        return execute(parser.parse(sql));
    }

    public Relation execute(Statement statement) {
        if (statement instanceof SelectStatement select) {
            return executor.execute(planner.plan(select));
        }
        if (statement instanceof InsertStatement insert) {
            return executeInsert(insert);
        }
        if (statement instanceof UpdateStatement || statement instanceof DeleteStatement) {
            String what = statement instanceof UpdateStatement ? "UPDATE" : "DELETE";
            throw new QueryException(ErrorKind.UNSUPPORTED_STATEMENT,
                what + " is parsed but not executed; sources are replaced wholesale through INSERT or SELECT ... INTO");
        }
        if (statement == null) throw new QueryException(ErrorKind.NULL_INPUT, "Cannot execute a null statement");
        throw new IllegalStateException("Unknown statement: " + statement);
    }

    // The literal rows become the relation handed to the loader as-is.
    private Relation executeInsert(InsertStatement insert) {
        int width = insert.rows().isEmpty() ? insert.columns().size() : insert.rows().get(0).size();
        List<String> columns = new ArrayList<>(width);
        if (insert.columns().isEmpty()) {
            for (int i = 0; i < width; i++) columns.add("c" + i);
        } else {
            for (ColumnRef c : insert.columns()) columns.add(c.describe());
        }
        Relation.Builder builder = new Relation.Builder(columns);
        for (List<Object> row : insert.rows()) {
            List<Object> cells = new ArrayList<>(row.size());
            for (Object v : row) cells.add(Values.normalize(v));
            builder.add(cells);
        }
        Relation relation = builder.build();
        executor.load(relation, insert.target());
        return new Relation(DIAGNOSTIC_COLUMNS, List.of(Record.of("INSERT", relation.rowCount())));
    }
}
