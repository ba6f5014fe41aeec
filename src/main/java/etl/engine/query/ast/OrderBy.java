package etl.engine.query.ast;

import java.util.List;

/** Parameters in priority order; the first one is the primary sort key. */
public record OrderBy(List<OrderByParameter> parameters) {
    public OrderBy {
        parameters = List.copyOf(parameters);
        if (parameters.isEmpty()) throw new IllegalArgumentException("ORDER BY needs at least one parameter");
    }

    public boolean hasAggregation() {
        for (OrderByParameter p : parameters) if (p.parameter() instanceof Aggregation) return true;
        return false;
    }
}
