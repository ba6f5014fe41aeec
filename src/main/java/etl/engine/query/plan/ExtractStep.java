package etl.engine.query.plan;

import etl.engine.query.ast.Datasource;

/** Pull one relation from a source. alias is null when the query gave none. */
public record ExtractStep(String id, Datasource datasource, String alias) implements PlanStep {}
