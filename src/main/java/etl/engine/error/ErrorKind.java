package etl.engine.error;

/**
 * Discriminates every failure the engine can report.
 */
public enum ErrorKind {
    // parse time
    SYNTAX_ERROR,
    AGGREGATION_ON_WILDCARD_DISALLOWED,

    // plan time
    DUPLICATE_ALIAS,
    UNKNOWN_ALIAS,
    UNSUPPORTED_JOIN_CONDITION,

    // execution
    COLUMN_NOT_IN_GROUP_BY,
    MIXED_AGGREGATION_WITHOUT_GROUP,
    COLUMN_INDEX_OUT_OF_RANGE,
    COLUMN_NOT_FOUND,
    DUPLICATE_COLUMN,
    INVALID_JOIN_KIND,
    MISSING_JOIN_COLUMN,
    JOIN_FAILED,
    INVALID_LIMIT,
    INVALID_ORDER_BY,
    INVALID_AGGREGATION,
    TYPE_MISMATCH,
    NULL_INPUT,
    UNSUPPORTED_STATEMENT,

    // adapters
    UNKNOWN_SOURCE_TYPE,
    EXTRACT_FAILED,
    LOAD_FAILED
}
