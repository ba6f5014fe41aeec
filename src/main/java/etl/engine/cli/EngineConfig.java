package etl.engine.cli;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

public class EngineConfig {
    public static final String DEFAULT_PROMPT = "etl> ";

    public final Path dataDir;
    public final char csvDelimiter;
    public final int maxDisplayRows;
    public final Path scriptFile;
    public final String prompt;

    public EngineConfig(Path dataDir, char csvDelimiter, int maxDisplayRows, Path scriptFile, String prompt) {
        this.dataDir = dataDir;
        this.csvDelimiter = csvDelimiter;
        this.maxDisplayRows = maxDisplayRows;
        this.scriptFile = scriptFile;
        this.prompt = prompt;
    }

    public static EngineConfig defaultConfig() {
        return new EngineConfig(
                Path.of("data"),
                ',',
                100,   // rows shown per result table
                null,  // interactive
                DEFAULT_PROMPT
        );
    }

    /** Shape of the optional JSON file given with --config=. Absent keys keep defaults. */
    static final class FileSettings {
        String dataDir;
        String delimiter;
        Integer maxRows;
        String prompt;
    }

    public static EngineConfig fromArgs(String[] args) {
        EngineConfig base = defaultConfig();
        Path dataDir = base.dataDir;
        char delimiter = base.csvDelimiter;
        int maxRows = base.maxDisplayRows;
        Path script = null;
        String prompt = base.prompt;

        // --config= is applied first so the other flags override it regardless of order
        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--config=")) {
                FileSettings f = readFile(Path.of(s.substring("--config=".length())));
                if (f == null) continue;
                if (f.dataDir != null) dataDir = Path.of(f.dataDir);
                if (f.delimiter != null) delimiter = delimiter(f.delimiter, delimiter);
                if (f.maxRows != null) maxRows = positive(f.maxRows, maxRows, "maxRows");
                if (f.prompt != null) prompt = f.prompt;
            }
        }

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--data-dir=")) {
                dataDir = Path.of(s.substring("--data-dir=".length()));
            } else if (s.startsWith("--delimiter=")) {
                delimiter = delimiter(s.substring("--delimiter=".length()), delimiter);
            } else if (s.startsWith("--max-rows=")) {
                try {
                    maxRows = positive(Integer.parseInt(s.substring("--max-rows=".length())), maxRows, "--max-rows");
                } catch (NumberFormatException e) {
                    warn("Ignoring malformed " + s + ", keeping " + maxRows);
                }
            } else if (s.startsWith("--file=")) {
                script = Path.of(s.substring("--file=".length()));
            } else if (!s.startsWith("--config=") && !s.isEmpty()) {
                warn("Ignoring unknown argument " + s);
            }
        }
        return new EngineConfig(dataDir, delimiter, maxRows, script, prompt);
    }

    private static FileSettings readFile(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            FileSettings f = new Gson().fromJson(reader, FileSettings.class);
            if (f == null) warn("Config file " + file + " is empty");
            return f;
        } catch (IOException | JsonParseException e) {
            warn("Could not read config file " + file + ": " + e.getMessage());
            return null;
        }
    }

    private static char delimiter(String raw, char fallback) {
        if ("\\t".equals(raw) || "tab".equalsIgnoreCase(raw)) return '\t';
        if (raw.length() == 1 && raw.charAt(0) != '"') return raw.charAt(0);
        warn("Delimiter must be a single character other than '\"', got '" + raw + "'; keeping '" + fallback + "'");
        return fallback;
    }

    private static int positive(int value, int fallback, String name) {
        if (value > 0) return value;
        warn(name + " must be positive, got " + value + "; keeping " + fallback);
        return fallback;
    }

    private static void warn(String msg) {
        System.err.println("[EngineConfig] " + msg);
    }

    public boolean interactive() {
        return scriptFile == null;
    }

    @Override
    public String toString() {
        return "EngineConfig{dataDir=" + dataDir + ", delimiter='" + csvDelimiter + "', maxRows=" + maxDisplayRows
            + ", script=" + scriptFile + "}";
    }
}
