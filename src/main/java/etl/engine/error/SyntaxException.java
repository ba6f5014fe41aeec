package etl.engine.error;

/**
 * Parse-time failure positioned at the offending token.
 */
public class SyntaxException extends QueryException {
    private final String token;
    private final int line;
    private final int column;

    public SyntaxException(String message, String token, int line, int column) {
        this(ErrorKind.SYNTAX_ERROR, message, token, line, column);
    }

    public SyntaxException(ErrorKind kind, String message, String token, int line, int column) {
        super(kind, message + " at token '" + token + "' on line " + line + ", column " + column);
        this.token = token;
        this.line = line;
        this.column = column;
    }

    public String token() { return token; }
    public int line() { return line; }
    public int column() { return column; }
}
