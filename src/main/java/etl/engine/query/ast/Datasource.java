package etl.engine.query.ast;

/**
 * Where a relation is extracted from or loaded to: written {type:path}.
 * remote is populated only for earth-observation descriptors.
 */
public record Datasource(String sourceType, String path, RemoteDescriptor remote) {
    public static final String REMOTE_TYPE = "gee";

    public Datasource {
        if (sourceType == null || sourceType.isEmpty()) throw new IllegalArgumentException("sourceType must not be empty");
        if (path == null || path.isEmpty()) throw new IllegalArgumentException("path must not be empty");
    }

    public static Datasource of(String sourceType, String path) {
        return new Datasource(sourceType, path, null);
    }

    @Override
    public String toString() {
        return sourceType + ":" + path;
    }
}
