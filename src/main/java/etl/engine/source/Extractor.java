package etl.engine.source;

import java.io.IOException;

import etl.engine.data.Relation;

/**
 * Reads a relation from a source. The path is the text inside the
 * datasource literal, passed through unchanged.
 */
@FunctionalInterface
public interface Extractor {
    Relation extract(String path) throws IOException;
}
