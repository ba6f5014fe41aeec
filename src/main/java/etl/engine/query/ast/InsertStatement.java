package etl.engine.query.ast;

import java.util.List;

/**
 * INSERT INTO {type:path} [(cols)] VALUES (...), (...);
 * columns is empty when the statement does not name them.
 */
public record InsertStatement(Datasource target, List<ColumnRef> columns, List<List<Object>> rows) implements Statement {
    public InsertStatement {
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
    }
}
