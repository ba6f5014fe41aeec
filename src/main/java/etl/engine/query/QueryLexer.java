package etl.engine.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import etl.engine.error.SyntaxException;
import etl.engine.query.ast.AggregateFunction;

/**
 * Turns query text into tokens. Keywords are case-insensitive; aggregation
 * names only become AGGREGATION_FUNCTION tokens when followed by '(' so they
 * stay usable as column names.
 */
public class QueryLexer {
    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
    static {
        for (TokenType t : TokenType.values()) {
            if (t.isKeyword()) KEYWORDS.put(t.name(), t);
        }
    }

    private final String text;
    private int pos;
    private int line = 1;
    private int lineStart;

    public QueryLexer(String text) {
        if (text == null) throw new IllegalArgumentException("query text must not be null");
        this.text = text;
    }

    public static List<Token> tokenize(String text) {
        return new QueryLexer(text).tokens();
    }

    public List<Token> tokens() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipBlanksAndComments();
            if (pos >= text.length()) {
                out.add(new Token(TokenType.EOF, "<end of input>", null, line, column()));
                return out;
            }
            out.add(next());
        }
    }

    private Token next() {
        int startLine = line;
        int startCol = column();
        int start = pos;
        char ch = text.charAt(pos);

        if (Character.isLetter(ch) || ch == '_') {
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
            String word = text.substring(start, pos);
            TokenType kw = KEYWORDS.get(word.toUpperCase(Locale.ROOT));
            if (kw != null) return new Token(kw, word, null, startLine, startCol);
            if (AggregateFunction.isFunctionName(word) && nextNonBlank() == '(') {
                return new Token(TokenType.AGGREGATION_FUNCTION, word, word.toLowerCase(Locale.ROOT), startLine, startCol);
            }
            return new Token(TokenType.IDENTIFIER, word, word, startLine, startCol);
        }
        if (Character.isDigit(ch) || (ch == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            return number(startLine, startCol);
        }
        switch (ch) {
            case '\'':
                return string(startLine, startCol);
            case '[':
                return delimited(']', TokenType.BRACKETED_NAME, "bracketed column name", startLine, startCol);
            case '{':
                return delimited('}', TokenType.DATASOURCE, "datasource", startLine, startCol);
            case '#':
                return columnIndex(startLine, startCol);
            case ',':
                pos++;
                return new Token(TokenType.COMMA, ",", null, startLine, startCol);
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", null, startLine, startCol);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", null, startLine, startCol);
            case ';':
                pos++;
                return new Token(TokenType.SEMICOLON, ";", null, startLine, startCol);
            case '.':
                pos++;
                return new Token(TokenType.DOT, ".", null, startLine, startCol);
            case '*':
                pos++;
                return new Token(TokenType.STAR, "*", null, startLine, startCol);
            case '=':
                pos++;
                return new Token(TokenType.EQUAL, "=", null, startLine, startCol);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.NOT_EQUAL, "!=", null, startLine, startCol);
                }
                break;
            case '<':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.LESS_EQUAL, "<=", null, startLine, startCol);
                }
                if (peek(1) == '>') {
                    pos += 2;
                    return new Token(TokenType.NOT_EQUAL, "<>", null, startLine, startCol);
                }
                pos++;
                return new Token(TokenType.LESS, "<", null, startLine, startCol);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.GREATER_EQUAL, ">=", null, startLine, startCol);
                }
                pos++;
                return new Token(TokenType.GREATER, ">", null, startLine, startCol);
            default:
                break;
        }
        throw new SyntaxException("Unexpected character", String.valueOf(ch), startLine, startCol);
    }

    private Token number(int startLine, int startCol) {
        int start = pos;
        if (text.charAt(pos) == '-') pos++;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        boolean isFloat = false;
        if (pos < text.length() && text.charAt(pos) == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))) {
            isFloat = true;
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        }
        String raw = text.substring(start, pos);
        if (isFloat) return new Token(TokenType.FLOAT, raw, Double.parseDouble(raw), startLine, startCol);
        try {
            return new Token(TokenType.INTEGER, raw, Long.parseLong(raw), startLine, startCol);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Integer literal out of range", raw, startLine, startCol);
        }
    }

    // '' inside a string is an escaped quote
    private Token string(int startLine, int startCol) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\'') {
                if (peek(1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, text.substring(start, pos), sb.toString(), startLine, startCol);
            }
            sb.append(c);
            pos++;
            if (c == '\n') newLine();
        }
        throw new SyntaxException("Unterminated string literal", text.substring(start), startLine, startCol);
    }

    private Token delimited(char close, TokenType type, String what, int startLine, int startCol) {
        int start = pos;
        int end = text.indexOf(close, pos + 1);
        if (end < 0) throw new SyntaxException("Unterminated " + what, text.substring(start), startLine, startCol);
        String body = text.substring(pos + 1, end);
        if (body.indexOf('\n') >= 0) throw new SyntaxException(what + " must not span lines", text.substring(start, end + 1), startLine, startCol);
        pos = end + 1;
        return new Token(type, text.substring(start, pos), body, startLine, startCol);
    }

    private Token columnIndex(int startLine, int startCol) {
        int start = pos;
        pos++;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        String raw = text.substring(start, pos);
        if (raw.length() == 1) throw new SyntaxException("Column index needs digits after '#'", raw, startLine, startCol);
        try {
            return new Token(TokenType.COLUMN_INDEX, raw, Integer.parseInt(raw.substring(1)), startLine, startCol);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Column index out of range", raw, startLine, startCol);
        }
    }

    private void skipBlanksAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                pos++;
                newLine();
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '*') {
                int startLine = line;
                int startCol = column();
                int end = text.indexOf("*/", pos + 2);
                if (end < 0) throw new SyntaxException("Unterminated comment", "/*", startLine, startCol);
                for (int i = pos; i < end; i++) {
                    if (text.charAt(i) == '\n') {
                        line++;
                        lineStart = i + 1;
                    }
                }
                pos = end + 2;
            } else {
                return;
            }
        }
    }

    private char nextNonBlank() {
        int i = pos;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private int column() {
        return pos - lineStart + 1;
    }
}
