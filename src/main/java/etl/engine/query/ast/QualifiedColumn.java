package etl.engine.query.ast;

/** alias.column or alias.[column] */
public record QualifiedColumn(String alias, String column) implements ColumnRef {
    @Override
    public String describe() { return alias + "." + column; }
}
