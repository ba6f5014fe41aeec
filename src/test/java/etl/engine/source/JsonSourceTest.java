package etl.engine.source;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;

import etl.engine.data.Record;
import etl.engine.data.Relation;

public class JsonSourceTest {

    @TempDir
    Path dir;

    @Test
    void columnsAreUnionOfKeysInFirstSeenOrder() throws IOException {
        String json = "[{\"id\": 1, \"name\": \"pen\"}, {\"id\": 2.5, \"extra\": true, \"tags\": [1, 2]}]";
        Relation r = new JsonSource(dir).read(new StringReader(json));
        assertEquals(List.of("id", "name", "extra", "tags"), r.columns());
        assertEquals(new Record(Arrays.asList(1L, "pen", null, null)), r.rows().get(0));
        assertEquals(new Record(Arrays.asList(2.5d, null, true, "[1,2]")), r.rows().get(1));
    }

    @Test
    void nonArrayRootIsRejected() {
        assertThrows(IOException.class, () -> new JsonSource(dir).read(new StringReader("{\"a\": 1}")));
        assertThrows(IOException.class, () -> new JsonSource(dir).read(new StringReader("[1, 2]")));
    }

    @Test
    void writesPrettyPrintedArrayWithNulls() {
        Relation r = new Relation.Builder(List.of("id", "name"))
            .add(Arrays.asList(1L, null))
            .build();
        StringWriter out = new StringWriter();
        new JsonSource(dir).write(r, out);
        JsonArray arr = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertEquals(1, arr.size());
        assertTrue(arr.get(0).getAsJsonObject().has("name"));
        assertTrue(out.toString().contains("\n"));
    }

    @Test
    void roundTripThroughFile() throws IOException {
        JsonSource json = new JsonSource(dir);
        Relation r = new Relation.Builder(List.of("id", "price", "ok"))
            .add(Record.of(1, 9.5, false))
            .build();
        json.load(r, "r.json");
        assertTrue(Files.exists(dir.resolve("r.json")));
        assertEquals(r, json.extract("r.json"));
    }

    @Test
    void malformedFileIsIoError() throws IOException {
        Files.writeString(dir.resolve("bad.json"), "[{\"a\": ");
        assertThrows(IOException.class, () -> new JsonSource(dir).extract("bad.json"));
    }
}
