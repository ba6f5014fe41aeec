package etl.engine.query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import etl.engine.data.Relation;
import etl.engine.error.ErrorKind;
import etl.engine.error.QueryException;
import etl.engine.exec.AliasBindings;
import etl.engine.exec.ColumnResolver;
import etl.engine.exec.JoinKind;
import etl.engine.exec.JoinOperator;
import etl.engine.exec.Transformer;
import etl.engine.query.ast.ColumnIndex;
import etl.engine.query.ast.ColumnName;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.Datasource;
import etl.engine.query.ast.QualifiedColumn;
import etl.engine.query.plan.ExecutionPlan;
import etl.engine.query.plan.ExtractStep;
import etl.engine.query.plan.JoinKey;
import etl.engine.query.plan.JoinStep;
import etl.engine.query.plan.LoadStep;
import etl.engine.query.plan.PlanStep;
import etl.engine.query.plan.TransformStep;
import etl.engine.source.SourceRegistry;

/**
 * Interprets an ExecutionPlan step by step: extracts every source, folds the
 * joins left to right onto the first source, transforms the result and
 * optionally loads it to a sink. The transformed relation is returned either way.
 */
public class QueryExecutor {
    private final SourceRegistry sources;
    private final Transformer transformer = new Transformer();

    public QueryExecutor(SourceRegistry sources) {
        if (sources == null) throw new IllegalArgumentException("sources must not be null");
        this.sources = sources;
    }

    private record Extracted(Relation relation, AliasBindings bindings) {}

    public Relation execute(ExecutionPlan plan) {
        if (plan == null) throw new QueryException(ErrorKind.NULL_INPUT, "Cannot execute a null plan");

        Map<String, Extracted> extracted = new HashMap<>();
        Relation current = null;
        AliasBindings bindings = AliasBindings.none();
        for (PlanStep step : plan.steps()) {
            if (step instanceof ExtractStep e) {
                Relation r = extract(e.datasource());
                Extracted x = new Extracted(r, AliasBindings.forSource(e.alias(), r.columns()));
                extracted.put(e.id(), x);
                if (current == null) {
                    current = r;
                    bindings = x.bindings();
                }
            } else if (step instanceof JoinStep j) {
                Extracted right = extracted.get(j.rightStepId());
                if (right == null) throw new IllegalStateException("Join refers to unknown step " + j.rightStepId());
                List<String> leftColumns = new ArrayList<>();
                List<String> rightColumns = new ArrayList<>();
                for (JoinKey k : j.keys()) {
                    leftColumns.add(keyColumn(k.left(), current, bindings));
                    rightColumns.add(keyColumn(k.right(), right.relation(), right.bindings()));
                }
                current = JoinOperator.join(current, right.relation(), leftColumns, rightColumns, JoinKind.of(j.type()));
                bindings = AliasBindings.afterJoin(bindings, right.bindings(), current.columns());
            } else if (step instanceof TransformStep t) {
                current = transformer.transform(current, t.criteria(), bindings);
                bindings = AliasBindings.none();
            } else if (step instanceof LoadStep l) {
                load(current, l.destination());
            } else {
                throw new IllegalStateException("Unknown plan step: " + step);
            }
        }
        if (current == null) throw new IllegalStateException("Plan produced no relation");
        return current;
    }

    // Unresolvable names are passed through so the join reports which side lacks them.
    private static String keyColumn(ColumnRef ref, Relation relation, AliasBindings bindings) {
        if (ref instanceof ColumnIndex) return new ColumnResolver(relation.columns(), bindings).resolve(ref);
        if (ref instanceof QualifiedColumn q) {
            String current = bindings.lookup(q.alias(), q.column());
            if (current == null && ColumnResolver.withoutFootnote(q.column()) != null) {
                current = bindings.lookup(q.alias(), ColumnResolver.withoutFootnote(q.column()));
            }
            return present(current != null ? current : q.column(), relation);
        }
        return present(((ColumnName) ref).name(), relation);
    }

    private static String present(String name, Relation relation) {
        if (relation.columns().contains(name)) return name;
        String bare = ColumnResolver.withoutFootnote(name);
        return bare != null && relation.columns().contains(bare) ? bare : name;
    }

    private Relation extract(Datasource ds) {
        try {
            return sources.extract(ds.sourceType(), ds.path());
        } catch (QueryException e) {
            if (e.kind() == ErrorKind.UNKNOWN_SOURCE_TYPE) throw e;
            throw new QueryException(ErrorKind.EXTRACT_FAILED, "Extraction from " + ds + " failed: " + e.getMessage(), e);
        } catch (IOException | RuntimeException e) {
            throw new QueryException(ErrorKind.EXTRACT_FAILED, "Extraction from " + ds + " failed: " + e.getMessage(), e);
        }
    }

    void load(Relation relation, Datasource ds) {
        try {
            sources.load(relation, ds.sourceType(), ds.path());
        } catch (QueryException e) {
            if (e.kind() == ErrorKind.UNKNOWN_SOURCE_TYPE) throw e;
            throw new QueryException(ErrorKind.LOAD_FAILED, "Load into " + ds + " failed: " + e.getMessage(), e);
        } catch (IOException | RuntimeException e) {
            throw new QueryException(ErrorKind.LOAD_FAILED, "Load into " + ds + " failed: " + e.getMessage(), e);
        }
    }
}
