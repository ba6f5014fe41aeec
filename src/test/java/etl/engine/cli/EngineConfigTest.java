package etl.engine.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EngineConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaultsWithoutArguments() {
        EngineConfig c = EngineConfig.fromArgs(new String[0]);
        assertEquals(Path.of("data"), c.dataDir);
        assertEquals(',', c.csvDelimiter);
        assertEquals(100, c.maxDisplayRows);
        assertTrue(c.interactive());
        assertEquals(EngineConfig.DEFAULT_PROMPT, c.prompt);
    }

    @Test
    void flagsOverrideDefaults() {
        EngineConfig c = EngineConfig.fromArgs(new String[] {
            "--data-dir=/tmp/etl", "--delimiter=\\t", "--max-rows=5", "--file=run.sql"
        });
        assertEquals(Path.of("/tmp/etl"), c.dataDir);
        assertEquals('\t', c.csvDelimiter);
        assertEquals(5, c.maxDisplayRows);
        assertEquals(Path.of("run.sql"), c.scriptFile);
        assertFalse(c.interactive());
    }

    @Test
    void malformedValuesKeepDefaults() {
        EngineConfig c = EngineConfig.fromArgs(new String[] {"--max-rows=lots", "--delimiter=;;", "--max-rows=0", null});
        assertEquals(100, c.maxDisplayRows);
        assertEquals(',', c.csvDelimiter);
    }

    @Test
    void configFileIsOverriddenByFlags() throws IOException {
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"dataDir\": \"warehouse\", \"delimiter\": \"|\", \"maxRows\": 20, \"prompt\": \"q> \"}");
        EngineConfig c = EngineConfig.fromArgs(new String[] {"--max-rows=7", "--config=" + file});
        assertEquals(Path.of("warehouse"), c.dataDir);
        assertEquals('|', c.csvDelimiter);
        assertEquals(7, c.maxDisplayRows);
        assertEquals("q> ", c.prompt);
    }

    @Test
    void unreadableConfigFileIsIgnored() {
        EngineConfig c = EngineConfig.fromArgs(new String[] {"--config=" + dir.resolve("missing.json")});
        assertEquals(Path.of("data"), c.dataDir);
    }
}
