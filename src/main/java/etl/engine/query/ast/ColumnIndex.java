package etl.engine.query.ast;

/** Positional reference, written #n, 0-based. */
public record ColumnIndex(int index) implements ColumnRef {
    @Override
    public String describe() { return "#" + index; }
}
