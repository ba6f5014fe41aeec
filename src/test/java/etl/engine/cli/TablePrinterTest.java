package etl.engine.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import etl.engine.data.Record;
import etl.engine.data.Relation;

public class TablePrinterTest {

    private static String render(Relation r, int maxRows) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        TablePrinter.print(r, maxRows, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void rendersAsciiTable() {
        Relation r = new Relation.Builder(List.of("id", "name"))
            .add(Record.of(1, "Alice"))
            .add(Arrays.asList(22L, null))
            .build();
        String[] lines = render(r, 10).split("\\R");
        assertEquals("+----+-------+", lines[0]);
        assertEquals("| id | name  |", lines[1]);
        assertEquals("| 1  | Alice |", lines[3]);
        assertEquals("| 22 |       |", lines[4]);
        assertEquals("(2 row(s))", lines[6]);
    }

    @Test
    void capsDisplayedRows() {
        Relation.Builder b = new Relation.Builder(List.of("n"));
        for (int i = 0; i < 5; i++) b.add(Record.of(i));
        String out = render(b.build(), 2);
        assertTrue(out.contains("... 3 more"));
        assertTrue(out.contains("(5 row(s))"));
        assertFalse(out.contains("| 2 |"));
    }

    @Test
    void relationWithoutColumns() {
        assertEquals("(0 row(s))", render(Relation.empty(), 10).trim());
    }
}
