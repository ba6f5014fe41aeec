package etl.engine.cli;

/**
 * Accumulates input lines until a complete statement is available. A
 * statement ends at a ';' that is not inside a string literal, a datasource
 * literal, a bracketed column name or a comment.
 */
public final class StatementReader {
    private final StringBuilder buffer = new StringBuilder();

    /**
     * Appends one line of input. Returns the completed statement (including
     * its ';') or null when more input is needed. Text after the ';' stays
     * buffered for the next statement.
     */
    public String feed(String line) {
        if (buffer.length() > 0) buffer.append('\n');
        buffer.append(line);
        return poll();
    }

    /** Next complete statement already in the buffer, or null. */
    public String poll() {
        int end = terminator(buffer);
        if (end < 0) return null;
        String stmt = buffer.substring(0, end + 1).trim();
        buffer.delete(0, end + 1);
        if (buffer.toString().isBlank()) buffer.setLength(0);
        return stmt;
    }

    public boolean isEmpty() {
        return buffer.toString().isBlank();
    }

    /** Whatever is left without a terminator, cleared. */
    public String drain() {
        String rest = buffer.toString().trim();
        buffer.setLength(0);
        return rest;
    }

    static int terminator(CharSequence s) {
        char close = 0;
        boolean comment = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (comment) {
                if (c == '*' && i + 1 < s.length() && s.charAt(i + 1) == '/') {
                    comment = false;
                    i++;
                }
            } else if (close != 0) {
                if (c == close) close = 0;
            } else if (c == '/' && i + 1 < s.length() && s.charAt(i + 1) == '*') {
                comment = true;
                i++;
            } else if (c == '\'') {
                close = '\'';
            } else if (c == '{') {
                close = '}';
            } else if (c == '[') {
                close = ']';
            } else if (c == ';') {
                return i;
            }
        }
        return -1;
    }
}
