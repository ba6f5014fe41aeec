package etl.engine.query.ast;

public enum ComparisonOp {
    EQ("="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

    private final String symbol;

    ComparisonOp(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }

    public static ComparisonOp fromSymbol(String s) {
        return switch (s) {
            case "=" -> EQ;
            case "!=", "<>" -> NE;
            case "<" -> LT;
            case "<=" -> LE;
            case ">" -> GT;
            case ">=" -> GE;
            default -> throw new IllegalArgumentException("Unsupported operator: " + s);
        };
    }
}
