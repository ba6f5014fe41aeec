package etl.engine.exec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.data.Values;

/**
 * Drops rows that duplicate an earlier row across all columns; the first
 * occurrence wins.
 */
public class DistinctOperator implements Operator {
    @Override
    public Relation apply(Relation input) {
        Set<List<Object>> seen = new LinkedHashSet<>();
        List<Record> kept = new ArrayList<>();
        for (Record r : input.rows()) {
            List<Object> key = new ArrayList<>(r.size());
            for (Object v : r.getValues()) key.add(Values.hashKey(v));
            if (seen.add(key)) kept.add(r);
        }
        return input.withRows(kept);
    }
}
