package etl.engine.exec;

import java.util.regex.Pattern;

import etl.engine.data.Record;

/**
 * SQL LIKE: % matches any run of characters, _ exactly one. Case-sensitive.
 * Non-string cells are matched on their text form; null never matches.
 */
public class LikePredicate implements Predicate {
    private final ValueSource operand;
    private final String pattern;
    private final Pattern regex;

    public LikePredicate(ValueSource operand, String pattern) {
        this.operand = operand;
        this.pattern = pattern;
        this.regex = toRegex(pattern);
    }

    static Pattern toRegex(String like) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : like.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    @Override
    public boolean test(Record row) {
        Object v = operand.value(row);
        if (v == null) return false;
        return regex.matcher(v.toString()).matches();
    }

    @Override
    public String toString() { return operand + " LIKE '" + pattern + "'"; }
}
