package etl.engine.exec;

import etl.engine.data.Relation;

/**
 * Relational operator over a materialized relation. Implementations never
 * modify their input; they return a new relation.
 */
public interface Operator {
    Relation apply(Relation input);
}
