package etl.engine.query.ast;

import java.util.List;

public record UpdateStatement(Datasource target, List<Assignment> assignments, Condition where) implements Statement {
    public UpdateStatement {
        assignments = List.copyOf(assignments);
    }
}
