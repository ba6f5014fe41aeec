package etl.engine.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;

/**
 * Immutable in-memory table: ordered unique column names plus ordered rows.
 * Every pipeline stage produces a fresh Relation; none mutates its input.
 */
public final class Relation {
    private static final Relation EMPTY = new Relation(List.of(), List.of());

    private final List<String> columns;
    private final List<Record> rows;

    public Relation(List<String> columns, List<Record> rows) {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        if (rows == null) throw new IllegalArgumentException("rows must not be null");
        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (c == null) throw new IllegalArgumentException("column name must not be null");
            if (!seen.add(c)) {
                throw new QueryException(ErrorKind.DUPLICATE_COLUMN, "Duplicate column name '" + c + "' in " + columns);
            }
        }
        for (Record r : rows) {
            if (r.size() != columns.size()) {
                throw new IllegalArgumentException("Row arity " + r.size() + " != column count " + columns.size() + ": " + r);
            }
        }
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /** Relation with neither columns nor rows. */
    public static Relation empty() {
        return EMPTY;
    }

    /** Relation with the given columns and no rows. */
    public static Relation empty(List<String> columns) {
        return new Relation(columns, List.of());
    }

    public List<String> columns() { return columns; }
    public List<Record> rows() { return rows; }
    public int rowCount() { return rows.size(); }
    public int columnCount() { return columns.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    /** Position of a column or -1. */
    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Same schema, different rows. */
    public Relation withRows(List<Record> newRows) {
        return new Relation(columns, newRows);
    }

    /** Shallow copy; records are immutable so sharing them is safe. */
    public Relation copy() {
        return new Relation(columns, rows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "Relation" + columns + " rows=" + rows.size();
    }

    /** Incremental builder used by operators and adapters. */
    public static final class Builder {
        private final List<String> columns;
        private final List<Record> rows = new ArrayList<>();

        public Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
        }

        public Builder add(Record record) {
            rows.add(record);
            return this;
        }

        public Builder add(List<Object> values) {
            rows.add(new Record(values));
            return this;
        }

        public Relation build() {
            return new Relation(columns, rows);
        }
    }
}
