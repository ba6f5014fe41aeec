package etl.engine.exec;

import java.util.Locale;

import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.JoinType;

public enum JoinKind {
    INNER, LEFT, RIGHT, OUTER;

    public static JoinKind parse(String kind) {
        if (kind != null) {
            switch (kind.trim().toLowerCase(Locale.ROOT)) {
                case "inner": return INNER;
                case "left": return LEFT;
                case "right": return RIGHT;
                case "outer": return OUTER;
                default: break;
            }
        }
        throw new QueryException(ErrorKind.INVALID_JOIN_KIND,
            "Invalid join type '" + kind + "'. Must be one of [inner, left, right, outer]");
    }

    public static JoinKind of(JoinType type) {
        return parse(type.kindName());
    }

    public String kindName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
