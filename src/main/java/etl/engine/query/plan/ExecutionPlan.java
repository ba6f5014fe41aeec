package etl.engine.query.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered extract / join / transform / load steps plus the alias table
 * (alias -> extract step id) built from the statement.
 */
public record ExecutionPlan(List<PlanStep> steps, Map<String, String> aliases) {
    public ExecutionPlan {
        steps = List.copyOf(steps);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public <T extends PlanStep> List<T> stepsOf(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (PlanStep s : steps) if (type.isInstance(s)) out.add(type.cast(s));
        return out;
    }

    public TransformStep transform() {
        List<TransformStep> t = stepsOf(TransformStep.class);
        if (t.size() != 1) throw new IllegalStateException("plan must contain exactly one transform step");
        return t.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ExecutionPlan");
        for (int i = 0; i < steps.size(); i++) sb.append("\n  ").append(i).append(": ").append(steps.get(i));
        return sb.toString();
    }
}
