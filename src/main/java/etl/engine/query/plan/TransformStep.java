package etl.engine.query.plan;

public record TransformStep(TransformCriteria criteria) implements PlanStep {}
