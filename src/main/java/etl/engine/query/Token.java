package etl.engine.query;

/**
 * Lexed token. value holds the decoded payload: the unquoted string, the
 * Long/Double of a number, the index of #n, the body of {...}.
 * line and column are 1-based.
 */
public record Token(TokenType type, String text, Object value, int line, int column) {
    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
