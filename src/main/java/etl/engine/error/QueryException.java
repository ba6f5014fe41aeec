package etl.engine.error;

/**
 * Terminal failure for the statement being processed. The kind tells callers
 * what went wrong without parsing the message.
 */
public class QueryException extends RuntimeException {
    private final ErrorKind kind;

    public QueryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
