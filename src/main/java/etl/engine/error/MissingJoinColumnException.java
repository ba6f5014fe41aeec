package etl.engine.error;

import java.util.List;

/**
 * A join key column is absent from one side of the join.
 */
public class MissingJoinColumnException extends QueryException {
    public enum Side { LEFT, RIGHT }

    private final Side side;
    private final String column;
    private final List<String> available;

    public MissingJoinColumnException(Side side, String column, List<String> available) {
        super(ErrorKind.MISSING_JOIN_COLUMN,
            "Column '" + column + "' not found in " + side.name().toLowerCase() + " relation. Available: " + available);
        this.side = side;
        this.column = column;
        this.available = List.copyOf(available);
    }

    public Side side() { return side; }
    public String column() { return column; }
    public List<String> available() { return available; }
}
