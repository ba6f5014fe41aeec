package etl.engine.query.ast;

/** Simple or bracketed column name. */
public record ColumnName(String name) implements ColumnRef {
    @Override
    public String describe() { return name; }
}
