package etl.engine.exec;

import java.util.ArrayList;
import java.util.List;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;

/**
 * Projection operator: keeps a subset of columns in the requested order.
 */
public class ProjectionOperator implements Operator {
    private final int[] columnIndexes; // indices to keep in output order

    public ProjectionOperator(int[] columnIndexes) {
        this.columnIndexes = columnIndexes.clone();
    }

    /**
     * Build a ProjectionOperator by resolving column names against a schema.
     */
    public static ProjectionOperator forColumnNames(List<String> schema, List<String> columnNames) {
        if (columnNames == null || columnNames.isEmpty()) throw new IllegalArgumentException("columnNames must be non-empty");
        int[] idxs = new int[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            int found = schema.indexOf(columnNames.get(i));
            if (found == -1) {
                throw new QueryException(ErrorKind.COLUMN_NOT_FOUND,
                    "Column '" + columnNames.get(i) + "' not found. Available: " + schema);
            }
            idxs[i] = found;
        }
        return new ProjectionOperator(idxs);
    }

    @Override
    public Relation apply(Relation input) {
        List<String> names = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) names.add(input.columns().get(idx));
        List<Record> rows = new ArrayList<>(input.rowCount());
        for (Record r : input.rows()) {
            List<Object> projected = new ArrayList<>(columnIndexes.length);
            for (int idx : columnIndexes) projected.add(r.get(idx));
            rows.add(new Record(projected));
        }
        return new Relation(names, rows);
    }
}
