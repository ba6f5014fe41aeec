package etl.engine.query.ast;

public enum SortDirection { ASC, DESC }
