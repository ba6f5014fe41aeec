package etl.engine.exec;

import etl.engine.data.Record;

/**
 * Operand of a compiled comparison: a column slot or a constant.
 */
public interface ValueSource {
    Object value(Record row);

    static ValueSource column(int index, String name) {
        return new ValueSource() {
            @Override public Object value(Record row) { return row.get(index); }
            @Override public String toString() { return name; }
        };
    }

    static ValueSource constant(Object v) {
        return new ValueSource() {
            @Override public Object value(Record row) { return v; }
            @Override public String toString() { return v instanceof String ? "'" + v + "'" : String.valueOf(v); }
        };
    }
}
