package etl.engine.exec;

import java.util.List;

import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.query.ast.ColumnIndex;
import etl.engine.query.ast.ColumnName;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.QualifiedColumn;

/**
 * Resolves column references to concrete column names of a relation schema.
 * A bracketed name ending in a footnote marker matches the column of that
 * exact name first, then the column without the marker.
 */
public final class ColumnResolver {
    private static final String FOOTNOTE_MARKERS = "*†‡";

    private final List<String> columns;
    private final AliasBindings bindings;

    public ColumnResolver(List<String> columns, AliasBindings bindings) {
        this.columns = columns;
        this.bindings = bindings == null ? AliasBindings.none() : bindings;
    }

    public String resolve(ColumnRef ref) {
        return resolve(ref, true);
    }

    /**
     * Resolves without dropping a trailing footnote marker. ORDER BY parameters
     * name columns verbatim.
     */
    public String resolveExact(ColumnRef ref) {
        return resolve(ref, false);
    }

    private String resolve(ColumnRef ref, boolean footnotes) {
        if (ref instanceof ColumnIndex ci) {
            if (ci.index() < 0 || ci.index() >= columns.size()) {
                throw new QueryException(ErrorKind.COLUMN_INDEX_OUT_OF_RANGE,
                    "Column index " + ci.index() + " out of range for " + columns.size() + " column(s) " + columns);
            }
            return columns.get(ci.index());
        }
        if (ref instanceof ColumnName cn) {
            String found = find(null, cn.name(), footnotes);
            if (found == null) throw notFound(ref);
            return found;
        }
        if (ref instanceof QualifiedColumn q) {
            String found = find(q.alias(), q.column(), footnotes);
            if (found == null) throw notFound(ref);
            return found;
        }
        throw new IllegalArgumentException("Unsupported column reference: " + ref);
    }

    private String find(String alias, String name, boolean footnotes) {
        String found = lookup(alias, name);
        if (found == null && footnotes) {
            String bare = withoutFootnote(name);
            if (bare != null) found = lookup(alias, bare);
        }
        return found;
    }

    private String lookup(String alias, String name) {
        if (alias != null && bindings.isBound(alias)) {
            String current = bindings.lookup(alias, name);
            return current != null && columns.contains(current) ? current : null;
        }
        // No lineage for this alias (single-source query): fall back to the bare name.
        return columns.contains(name) ? name : null;
    }

    /**
     * The name with a trailing {@code *}, {@code †} or {@code ‡} removed, or null
     * when it carries no such marker.
     */
    public static String withoutFootnote(String name) {
        if (name.length() < 2 || FOOTNOTE_MARKERS.indexOf(name.charAt(name.length() - 1)) < 0) return null;
        String bare = name.substring(0, name.length() - 1).trim();
        return bare.isEmpty() ? null : bare;
    }

    public int indexOf(ColumnRef ref) {
        return columns.indexOf(resolve(ref));
    }

    public List<String> columns() {
        return columns;
    }

    private QueryException notFound(ColumnRef ref) {
        return new QueryException(ErrorKind.COLUMN_NOT_FOUND,
            "Column '" + ref.describe() + "' not found. Available: " + columns);
    }
}
