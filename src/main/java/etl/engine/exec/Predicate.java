package etl.engine.exec;

import etl.engine.data.Record;

/**
 * Minimal predicate interface evaluated against a row.
 */
public interface Predicate {
    boolean test(Record row);
}
