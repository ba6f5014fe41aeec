package etl.engine.query.plan;

/**
 * One step of a lowered SELECT. Steps run strictly in list order.
 */
public interface PlanStep {}
