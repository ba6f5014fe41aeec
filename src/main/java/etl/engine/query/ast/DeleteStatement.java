package etl.engine.query.ast;

public record DeleteStatement(Datasource target, Condition where) implements Statement {}
