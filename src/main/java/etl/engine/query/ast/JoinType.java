package etl.engine.query.ast;

import java.util.Locale;

public enum JoinType {
    INNER, LEFT, RIGHT, OUTER;

    /** Lower-case kind name accepted by the join operator. */
    public String kindName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
