package etl.engine.source;

import java.io.IOException;

import etl.engine.data.Relation;
import etl.engine.query.ast.RemoteDescriptor;

/**
 * Fetches an observation time series for one point of a remote imagery
 * collection. Implementations live outside this engine.
 */
@FunctionalInterface
public interface RemoteCollector {
    Relation collect(RemoteDescriptor descriptor) throws IOException;
}
