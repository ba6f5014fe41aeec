package etl.engine.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;

/**
 * Maps source type tags ({csv:...}, {json:...}) to the adapters that read and
 * write them. Tags are case-insensitive.
 */
public class SourceRegistry {
    private final Map<String, Extractor> extractors = new ConcurrentHashMap<>();
    private final Map<String, Loader> loaders = new ConcurrentHashMap<>();

    /** csv, json and memory adapters with relative paths resolved against baseDir. */
    public static SourceRegistry withDefaults(Path baseDir) {
        return withDefaults(baseDir, CsvSource.DEFAULT_DELIMITER, new MemorySource());
    }

    public static SourceRegistry withDefaults(Path baseDir, char csvDelimiter, MemorySource memory) {
        SourceRegistry registry = new SourceRegistry();
        CsvSource csv = new CsvSource(baseDir, csvDelimiter);
        JsonSource json = new JsonSource(baseDir);
        registry.register("csv", csv, csv);
        registry.register("json", json, json);
        registry.register("memory", memory, memory);
        return registry;
    }

    public SourceRegistry register(String type, Extractor extractor, Loader loader) {
        String key = key(type);
        if (extractor != null) extractors.put(key, extractor);
        if (loader != null) loaders.put(key, loader);
        return this;
    }

    /** Registers the remote collector adapter under {@code gee}. */
    public SourceRegistry registerRemote(RemoteCollector collector) {
        return register(RemoteSource.TYPE, new RemoteSource(collector), null);
    }

    public boolean supports(String type) {
        return type != null && (extractors.containsKey(key(type)) || loaders.containsKey(key(type)));
    }

    public Relation extract(String type, String path) throws IOException {
        Extractor e = extractors.get(key(type));
        if (e == null) throw unknown(type, "extraction", extractors);
        Relation r = e.extract(path);
        if (r == null) throw new IOException("Extractor for '" + type + "' returned no relation for " + path);
        return r;
    }

    public void load(Relation relation, String type, String destination) throws IOException {
        Loader l = loaders.get(key(type));
        if (l == null) throw unknown(type, "loading", loaders);
        l.load(relation, destination);
    }

    private static String key(String type) {
        if (type == null) throw new IllegalArgumentException("source type must not be null");
        return type.toLowerCase(Locale.ROOT);
    }

    private static QueryException unknown(String type, String what, Map<String, ?> known) {
        return new QueryException(ErrorKind.UNKNOWN_SOURCE_TYPE,
            "No adapter registered for " + what + " of source type '" + type + "'. Known: " + new TreeSet<>(known.keySet()));
    }
}
