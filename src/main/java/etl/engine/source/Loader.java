package etl.engine.source;

import java.io.IOException;

import etl.engine.data.Relation;

/**
 * Writes a relation to a sink, replacing whatever the destination held.
 */
@FunctionalInterface
public interface Loader {
    void load(Relation relation, String destination) throws IOException;
}
