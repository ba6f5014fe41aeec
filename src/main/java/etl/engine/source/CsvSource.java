package etl.engine.source;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import etl.engine.data.Record;
import etl.engine.data.Relation;
import etl.engine.data.Values;

/**
 * Delimited text files with a header row. Quoting follows RFC 4180: fields
 * may be wrapped in double quotes, doubled quotes escape a quote, and quoted
 * fields may contain the delimiter or line breaks. Each column gets one type
 * inferred from all of its cells; an empty cell is null.
 */
public class CsvSource implements Extractor, Loader {
    public static final char DEFAULT_DELIMITER = ',';

    private final Path baseDir;
    private final char delimiter;

    public CsvSource(Path baseDir) {
        this(baseDir, DEFAULT_DELIMITER);
    }

    public CsvSource(Path baseDir, char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid CSV delimiter: " + delimiter);
        }
        this.baseDir = baseDir;
        this.delimiter = delimiter;
    }

    @Override
    public Relation extract(String path) throws IOException {
        Path file = SourcePaths.resolve(baseDir, path);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        }
    }

    Relation read(Reader reader, String origin) throws IOException {
        List<List<String>> records = parse(reader);
        if (records.isEmpty()) return Relation.empty();

        List<String> header = records.get(0);
        List<List<String>> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> fields = records.get(i);
            if (fields.size() == 1 && fields.get(0).isEmpty()) continue;
            if (fields.size() != header.size()) {
                throw new IOException(origin + ": line " + (i + 1) + " has " + fields.size()
                    + " field(s) but the header has " + header.size());
            }
            rows.add(fields);
        }

        List<List<Object>> typed = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            List<String> column = new ArrayList<>(rows.size());
            for (List<String> fields : rows) column.add(fields.get(c));
            typed.add(Values.parseColumn(column));
        }

        Relation.Builder builder = new Relation.Builder(header);
        for (int r = 0; r < rows.size(); r++) {
            List<Object> cells = new ArrayList<>(header.size());
            for (List<Object> column : typed) cells.add(column.get(r));
            builder.add(cells);
        }
        return builder.build();
    }

    private List<List<String>> parse(Reader in) throws IOException {
        List<List<String>> out = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean any = false;
        int c;
        while ((c = in.read()) != -1) {
            char ch = (char) c;
            any = true;
            if (quoted) {
                if (ch == '"') {
                    in.mark(1);
                    int n = in.read();
                    if (n == '"') {
                        field.append('"');
                    } else {
                        quoted = false;
                        if (n != -1) in.reset();
                    }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"' && field.length() == 0) {
                quoted = true;
            } else if (ch == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r') {
                    in.mark(1);
                    if (in.read() != '\n') in.reset();
                }
                fields.add(field.toString());
                field.setLength(0);
                out.add(fields);
                fields = new ArrayList<>();
                any = false;
            } else {
                field.append(ch);
            }
        }
        if (quoted) throw new IOException("Unterminated quoted field at end of input");
        if (any) {
            fields.add(field.toString());
            out.add(fields);
        }
        return out;
    }

    @Override
    public void load(Relation relation, String destination) throws IOException {
        Path file = SourcePaths.resolve(baseDir, destination);
        SourcePaths.createParent(file);
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeLine(w, new ArrayList<>(relation.columns()));
            for (Record r : relation.rows()) writeLine(w, r.getValues());
        }
    }

    private void writeLine(BufferedWriter w, List<?> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) w.write(delimiter);
            w.write(quote(cells.get(i)));
        }
        w.write('\n');
    }

    private String quote(Object v) {
        if (v == null) return "";
        String s = String.valueOf(v);
        if (s.indexOf(delimiter) >= 0 || s.indexOf('"') >= 0 || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            return '"' + s.replace("\"", "\"\"") + '"';
        }
        return s;
    }
}
