package etl.engine.query.plan;

import java.util.List;

import etl.engine.query.ast.JoinType;

/**
 * Join the accumulated relation with the output of extract step rightStepId.
 * Several keys mean a conjunction of equalities.
 */
public record JoinStep(String rightStepId, JoinType type, List<JoinKey> keys) implements PlanStep {
    public JoinStep {
        keys = List.copyOf(keys);
        if (keys.isEmpty()) throw new IllegalArgumentException("join needs at least one key");
    }
}
