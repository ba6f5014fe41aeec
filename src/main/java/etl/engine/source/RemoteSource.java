package etl.engine.source;

import java.io.IOException;

import etl.engine.data.Relation;
import etl.engine.query.ast.Datasource;
import etl.engine.query.ast.RemoteDescriptor;

/**
 * Extract-only adapter for {gee:project|dataset|start|end|lon|lat|scale}.
 * Parses the descriptor and hands it to the configured collector.
 */
public class RemoteSource implements Extractor {
    public static final String TYPE = Datasource.REMOTE_TYPE;

    private final RemoteCollector collector;

    public RemoteSource(RemoteCollector collector) {
        if (collector == null) throw new IllegalArgumentException("collector must not be null");
        this.collector = collector;
    }

    @Override
    public Relation extract(String path) throws IOException {
        RemoteDescriptor descriptor;
        try {
            descriptor = RemoteDescriptor.parse(path);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid remote descriptor '" + path + "': " + e.getMessage(), e);
        }
        System.err.println("[RemoteSource] Collecting " + descriptor.dataset() + " for project " + descriptor.project()
            + " from " + descriptor.startDate() + " to " + descriptor.endDate());
        return collector.collect(descriptor);
    }
}
