package etl.engine.cli;

import java.io.PrintStream;
import java.util.List;

import etl.engine.data.Record;
import etl.engine.data.Relation;

/**
 * Simple ASCII table printer for result relations.
 * Prints at most maxRows rows followed by a count of the ones left out.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(Relation relation, int maxRows) {
        print(relation, maxRows, System.out);
    }

    public static void print(Relation relation, int maxRows, PrintStream out) {
        if (relation == null || relation.columnCount() == 0) {
            out.println("(0 row(s))");
            return;
        }
        List<String> headers = relation.columns();
        int shown = Math.min(relation.rowCount(), Math.max(0, maxRows));
        List<Record> rows = relation.rows().subList(0, shown);

        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) widths[i] = headers.get(i).length();
        for (Record r : rows) {
            for (int i = 0; i < widths.length; i++) {
                String s = cell(r.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (Record r : rows) {
            out.println(buildLine(r.getValues(), widths));
        }
        out.println(divLine);
        if (shown < relation.rowCount()) out.println("... " + (relation.rowCount() - shown) + " more");
        out.println("(" + relation.rowCount() + " row(s))");
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(List<?> values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cell(values.get(i)), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String cell(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
