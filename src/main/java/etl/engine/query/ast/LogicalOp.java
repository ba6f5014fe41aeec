package etl.engine.query.ast;

public enum LogicalOp { AND, OR }
