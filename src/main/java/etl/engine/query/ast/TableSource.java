package etl.engine.query.ast;

/** Datasource with an optional alias (null when absent). */
public record TableSource(Datasource datasource, String alias) {}
