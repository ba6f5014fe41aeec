package etl.engine.query.ast;

// column = literal inside UPDATE ... SET
public record Assignment(ColumnRef column, Object value) {}
