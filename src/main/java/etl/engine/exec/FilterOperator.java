package etl.engine.exec;

import java.util.ArrayList;
import java.util.List;

import etl.engine.data.Record;
import etl.engine.data.Relation;

/**
 * Keeps the rows that satisfy a Predicate, in input order.
 */
public class FilterOperator implements Operator {
    private final Predicate predicate;

    public FilterOperator(Predicate predicate) {
        this.predicate = predicate;
    }

    @Override
    public Relation apply(Relation input) {
        List<Record> kept = new ArrayList<>();
        for (Record r : input.rows()) {
            if (predicate.test(r)) kept.add(r);
        }
        return input.withRows(kept);
    }
}
