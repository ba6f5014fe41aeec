package etl.engine.exec;

import etl.engine.query.ast.SortDirection;

/** Column position plus direction; one entry per ORDER BY parameter. */
public record SortKey(int columnIndex, SortDirection direction) {}
