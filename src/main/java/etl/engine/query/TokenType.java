package etl.engine.query;

public enum TokenType {
    // keywords
    SELECT, DISTINCT, INTO, FROM, AS, JOIN, INNER, LEFT, RIGHT, FULL, OUTER, ON,
    WHERE, AND, OR, NOT, LIKE, GROUP, ORDER, BY, ASC, DESC, LIMIT, TAIL,
    INSERT, VALUES, UPDATE, SET, DELETE, TRUE, FALSE,

    // names and literals
    IDENTIFIER,
    BRACKETED_NAME,
    COLUMN_INDEX,
    AGGREGATION_FUNCTION,
    DATASOURCE,
    STRING,
    INTEGER,
    FLOAT,

    // punctuation
    COMMA, LPAREN, RPAREN, SEMICOLON, DOT, STAR,
    EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    EOF;

    public boolean isKeyword() {
        return ordinal() <= FALSE.ordinal();
    }
}
