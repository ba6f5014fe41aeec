package etl.engine.source;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import etl.engine.data.Record;
import etl.engine.data.Relation;

/**
 * A JSON array of flat objects, one object per row. Columns are the union of
 * the object keys in first-seen order; a key missing from an object is null.
 * Nested objects and arrays are kept as their JSON text.
 */
public class JsonSource implements Extractor, Loader {
    private final Path baseDir;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public JsonSource(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public Relation extract(String path) throws IOException {
        Path file = SourcePaths.resolve(baseDir, path);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Malformed JSON in " + file + ": " + e.getMessage(), e);
        }
    }

    Relation read(Reader reader) throws IOException {
        JsonElement root = JsonParser.parseReader(reader);
        if (root.isJsonNull()) return Relation.empty();
        if (!root.isJsonArray()) throw new IOException("Expected a JSON array of objects but found " + kind(root));

        JsonArray array = root.getAsJsonArray();
        List<JsonObject> objects = new ArrayList<>(array.size());
        Set<String> columns = new LinkedHashSet<>();
        for (JsonElement e : array) {
            if (!e.isJsonObject()) throw new IOException("Expected a JSON object per row but found " + kind(e));
            JsonObject o = e.getAsJsonObject();
            objects.add(o);
            columns.addAll(o.keySet());
        }

        Relation.Builder builder = new Relation.Builder(new ArrayList<>(columns));
        for (JsonObject o : objects) {
            List<Object> cells = new ArrayList<>(columns.size());
            for (String c : columns) cells.add(toCell(o.get(c)));
            builder.add(cells);
        }
        return builder.build();
    }

    private static Object toCell(JsonElement e) {
        if (e == null || e.isJsonNull()) return null;
        if (!e.isJsonPrimitive()) return e.toString();
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean();
        if (p.isString()) return p.getAsString();
        String raw = p.getAsString();
        if (raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ignored) {
                // too large for a long; fall through to double
            }
        }
        return p.getAsDouble();
    }

    private static String kind(JsonElement e) {
        if (e.isJsonArray()) return "an array";
        if (e.isJsonObject()) return "an object";
        if (e.isJsonNull()) return "null";
        return "a primitive";
    }

    @Override
    public void load(Relation relation, String destination) throws IOException {
        Path file = SourcePaths.resolve(baseDir, destination);
        SourcePaths.createParent(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(relation, writer);
        }
    }

    void write(Relation relation, Writer writer) {
        List<Map<String, Object>> rows = new ArrayList<>(relation.rowCount());
        for (Record r : relation.rows()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < relation.columnCount(); i++) row.put(relation.columns().get(i), r.get(i));
            rows.add(row);
        }
        gson.toJson(rows, writer);
    }
}
