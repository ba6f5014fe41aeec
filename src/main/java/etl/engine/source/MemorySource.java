package etl.engine.source;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import etl.engine.data.Relation;

/**
 * Named relations held in memory, addressed as {memory:name}. Relations are
 * copied on the way in and out so callers never share rows with the store.
 */
public class MemorySource implements Extractor, Loader {
    private final Map<String, Relation> relations = new ConcurrentHashMap<>();

    public MemorySource put(String name, Relation relation) {
        if (name == null || relation == null) throw new IllegalArgumentException("name and relation must not be null");
        relations.put(name, relation.copy());
        return this;
    }

    public Optional<Relation> get(String name) {
        return Optional.ofNullable(relations.get(name)).map(Relation::copy);
    }

    public boolean remove(String name) {
        return relations.remove(name) != null;
    }

    @Override
    public Relation extract(String path) throws IOException {
        Relation r = relations.get(path);
        if (r == null) throw new IOException("No in-memory relation named '" + path + "'. Known: " + relations.keySet());
        return r.copy();
    }

    @Override
    public void load(Relation relation, String destination) {
        put(destination, relation);
    }
}
