package etl.engine.query.ast;

public record OrderByParameter(SelectItem parameter, SortDirection direction) {}
