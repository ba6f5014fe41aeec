package etl.engine.query.plan;

import etl.engine.query.ast.Datasource;

public record LoadStep(Datasource destination) implements PlanStep {}
