package etl.engine.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import etl.engine.error.ErrorKind;
import etl.engine.error.SyntaxException;
import etl.engine.query.ast.AggregateFunction;
import etl.engine.query.ast.Aggregation;
import etl.engine.query.ast.Assignment;
import etl.engine.query.ast.BinaryJoinCondition;
import etl.engine.query.ast.ColumnIndex;
import etl.engine.query.ast.ColumnName;
import etl.engine.query.ast.ColumnRef;
import etl.engine.query.ast.Comparison;
import etl.engine.query.ast.ComparisonOp;
import etl.engine.query.ast.Condition;
import etl.engine.query.ast.Datasource;
import etl.engine.query.ast.DeleteStatement;
import etl.engine.query.ast.InsertStatement;
import etl.engine.query.ast.JoinClause;
import etl.engine.query.ast.JoinCondition;
import etl.engine.query.ast.JoinEquality;
import etl.engine.query.ast.JoinType;
import etl.engine.query.ast.Like;
import etl.engine.query.ast.LimitClause;
import etl.engine.query.ast.Literal;
import etl.engine.query.ast.Logical;
import etl.engine.query.ast.LogicalOp;
import etl.engine.query.ast.Not;
import etl.engine.query.ast.Operand;
import etl.engine.query.ast.OrderBy;
import etl.engine.query.ast.OrderByParameter;
import etl.engine.query.ast.QualifiedColumn;
import etl.engine.query.ast.RemoteDescriptor;
import etl.engine.query.ast.SelectColumns;
import etl.engine.query.ast.SelectItem;
import etl.engine.query.ast.SelectStatement;
import etl.engine.query.ast.SortDirection;
import etl.engine.query.ast.Statement;
import etl.engine.query.ast.TableSource;
import etl.engine.query.ast.UpdateStatement;

/**
 * Recursive-descent parser for the query language:
 *   SELECT [DISTINCT] cols [INTO {type:path}] FROM {type:path} [AS alias]
 *     [[INNER|LEFT [OUTER]|RIGHT [OUTER]|FULL [OUTER]] JOIN {type:path} [AS alias] ON a.x = b.y [AND ...]]*
 *     [WHERE cond] [GROUP BY cols] [ORDER BY params] [LIMIT n | TAIL n];
 * plus INSERT / UPDATE / DELETE.
 * Parsing is pure: the parser keeps no state between calls.
 */
public class QueryParser {
    public Statement parse(String sql) {
        return parse(QueryLexer.tokenize(sql));
    }

    public Statement parse(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) throw new IllegalArgumentException("tokens must not be empty");
        return new Descent(tokens).statement();
    }

    /** Convenience for callers that only accept SELECT. */
    public SelectStatement parseSelect(String sql) {
        List<Token> tokens = QueryLexer.tokenize(sql);
        Statement st = parse(tokens);
        if (!(st instanceof SelectStatement select)) {
            Token first = tokens.get(0);
            throw new SyntaxException("Expected SELECT statement", first.text(), first.line(), first.column());
        }
        return select;
    }

    // One instance per parse call; holds the cursor.
    private static final class Descent {
        private final List<Token> tokens;
        private int pos;

        Descent(List<Token> tokens) {
            this.tokens = tokens;
        }

        Statement statement() {
            Token t = peek();
            Statement st = switch (t.type()) {
                case SELECT -> select();
                case INSERT -> insert();
                case UPDATE -> update();
                case DELETE -> delete();
                default -> throw error("Expected SELECT, INSERT, UPDATE or DELETE", t);
            };
            expect(TokenType.SEMICOLON, "';' to terminate the statement");
            expect(TokenType.EOF, "end of input after ';'");
            return st;
        }

        // ---- SELECT ----

        private SelectStatement select() {
            expect(TokenType.SELECT, "SELECT");
            boolean distinct = accept(TokenType.DISTINCT);
            SelectColumns columns = selectColumns();
            Datasource into = null;
            if (accept(TokenType.INTO)) into = datasource(expect(TokenType.DATASOURCE, "datasource after INTO"));
            expect(TokenType.FROM, "FROM");
            TableSource source = tableSource();

            List<JoinClause> joins = new ArrayList<>();
            while (atJoinStart()) joins.add(joinClause());

            Condition where = accept(TokenType.WHERE) ? condition() : null;

            List<ColumnRef> groupBy = null;
            if (accept(TokenType.GROUP)) {
                expect(TokenType.BY, "BY after GROUP");
                groupBy = columnList();
            }

            OrderBy orderBy = null;
            if (accept(TokenType.ORDER)) {
                expect(TokenType.BY, "BY after ORDER");
                List<OrderByParameter> params = new ArrayList<>();
                do {
                    params.add(orderByParameter());
                } while (accept(TokenType.COMMA));
                orderBy = new OrderBy(params);
            }

            LimitClause limit = null;
            if (peek().is(TokenType.LIMIT) || peek().is(TokenType.TAIL)) {
                LimitClause.Kind kind = advance().is(TokenType.LIMIT) ? LimitClause.Kind.LIMIT : LimitClause.Kind.TAIL;
                Token n = expect(TokenType.INTEGER, "integer row count");
                limit = new LimitClause(kind, (Long) n.value());
            }
            return new SelectStatement(distinct, columns, into, source, joins, where, groupBy, orderBy, limit);
        }

        private SelectColumns selectColumns() {
            if (accept(TokenType.STAR)) return SelectColumns.all();
            List<SelectItem> items = new ArrayList<>();
            do {
                items.add(selectItem());
            } while (accept(TokenType.COMMA));
            return SelectColumns.of(items);
        }

        private SelectItem selectItem() {
            if (peek().is(TokenType.AGGREGATION_FUNCTION)) return aggregation();
            return column();
        }

        private Aggregation aggregation() {
            Token fn = advance();
            AggregateFunction function = AggregateFunction.fromName((String) fn.value());
            expect(TokenType.LPAREN, "'(' after " + fn.text());
            Aggregation agg;
            if (peek().is(TokenType.STAR)) {
                Token star = advance();
                if (!function.acceptsWildcard()) {
                    throw new SyntaxException(ErrorKind.AGGREGATION_ON_WILDCARD_DISALLOWED,
                        "Cannot use * with " + function.sqlName() + "(); only size(*) accepts it",
                        star.text(), star.line(), star.column());
                }
                agg = Aggregation.wildcard(function);
            } else {
                agg = new Aggregation(function, column());
            }
            expect(TokenType.RPAREN, "')' to close " + fn.text() + "(");
            return agg;
        }

        private OrderByParameter orderByParameter() {
            SelectItem item = selectItem();
            SortDirection dir = SortDirection.ASC;
            if (accept(TokenType.DESC)) dir = SortDirection.DESC;
            else accept(TokenType.ASC);
            return new OrderByParameter(item, dir);
        }

        private TableSource tableSource() {
            Datasource ds = datasource(expect(TokenType.DATASOURCE, "datasource {type:path}"));
            String alias = null;
            if (accept(TokenType.AS)) alias = expect(TokenType.IDENTIFIER, "alias after AS").text();
            return new TableSource(ds, alias);
        }

        // ---- JOIN ----

        private boolean atJoinStart() {
            return switch (peek().type()) {
                case JOIN, INNER, LEFT, RIGHT, FULL -> true;
                default -> false;
            };
        }

        private JoinClause joinClause() {
            JoinType type = joinType();
            TableSource source = tableSource();
            expect(TokenType.ON, "ON after joined datasource");
            return new JoinClause(type, source, joinOr());
        }

        private JoinType joinType() {
            Token t = advance();
            JoinType type;
            switch (t.type()) {
                case JOIN:
                    return JoinType.INNER;
                case INNER:
                    type = JoinType.INNER;
                    break;
                case LEFT:
                    accept(TokenType.OUTER);
                    type = JoinType.LEFT;
                    break;
                case RIGHT:
                    accept(TokenType.OUTER);
                    type = JoinType.RIGHT;
                    break;
                case FULL:
                    accept(TokenType.OUTER);
                    type = JoinType.OUTER;
                    break;
                default:
                    throw error("Expected JOIN", t);
            }
            expect(TokenType.JOIN, "JOIN");
            return type;
        }

        private JoinCondition joinOr() {
            JoinCondition left = joinAnd();
            while (accept(TokenType.OR)) left = new BinaryJoinCondition(LogicalOp.OR, left, joinAnd());
            return left;
        }

        private JoinCondition joinAnd() {
            JoinCondition left = joinEquality();
            while (accept(TokenType.AND)) left = new BinaryJoinCondition(LogicalOp.AND, left, joinEquality());
            return left;
        }

        private JoinCondition joinEquality() {
            ColumnRef left = column();
            expect(TokenType.EQUAL, "'=' in join condition");
            ColumnRef right = column();
            return new JoinEquality(left, right);
        }

        // ---- WHERE ----

        private Condition condition() {
            Condition left = andCondition();
            while (accept(TokenType.OR)) left = new Logical(LogicalOp.OR, left, andCondition());
            return left;
        }

        private Condition andCondition() {
            Condition left = notCondition();
            while (accept(TokenType.AND)) left = new Logical(LogicalOp.AND, left, notCondition());
            return left;
        }

        private Condition notCondition() {
            if (accept(TokenType.NOT)) return new Not(notCondition());
            return primaryCondition();
        }

        private Condition primaryCondition() {
            if (accept(TokenType.LPAREN)) {
                Condition inner = condition();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            Operand left = operand();
            if (accept(TokenType.LIKE)) {
                Token pattern = expect(TokenType.STRING, "string pattern after LIKE");
                return new Like(left, (String) pattern.value());
            }
            Token op = advance();
            ComparisonOp cmp = switch (op.type()) {
                case EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> ComparisonOp.fromSymbol(op.text());
                default -> throw error("Expected comparison operator or LIKE", op);
            };
            return new Comparison(left, cmp, operand());
        }

        private Operand operand() {
            Token t = peek();
            return switch (t.type()) {
                case STRING, INTEGER, FLOAT, TRUE, FALSE -> new Literal(literal());
                default -> column();
            };
        }

        private Object literal() {
            Token t = advance();
            return switch (t.type()) {
                case STRING, INTEGER, FLOAT -> t.value();
                case TRUE -> Boolean.TRUE;
                case FALSE -> Boolean.FALSE;
                default -> throw error("Expected literal value", t);
            };
        }

        // ---- columns ----

        private List<ColumnRef> columnList() {
            List<ColumnRef> cols = new ArrayList<>();
            do {
                cols.add(column());
            } while (accept(TokenType.COMMA));
            return cols;
        }

        private ColumnRef column() {
            Token t = advance();
            switch (t.type()) {
                case IDENTIFIER:
                    if (accept(TokenType.DOT)) {
                        Token c = advance();
                        if (c.is(TokenType.IDENTIFIER)) return new QualifiedColumn(t.text(), c.text());
                        if (c.is(TokenType.BRACKETED_NAME)) return new QualifiedColumn(t.text(), bracketed(c));
                        throw error("Expected column name after '" + t.text() + ".'", c);
                    }
                    return new ColumnName(t.text());
                case BRACKETED_NAME:
                    return new ColumnName(bracketed(t));
                case COLUMN_INDEX:
                    return new ColumnIndex((Integer) t.value());
                default:
                    throw error("Expected column", t);
            }
        }

        private String bracketed(Token t) {
            String name = (String) t.value();
            if (name.isBlank()) throw error("Empty bracketed column name", t);
            return name;
        }

        private Datasource datasource(Token t) {
            String body = ((String) t.value()).trim();
            int colon = body.indexOf(':');
            if (colon < 0) throw error("Datasource must be written {type:path}", t);
            String type = body.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String path = body.substring(colon + 1).trim();
            if (type.isEmpty() || path.isEmpty()) throw error("Datasource needs both a type and a path", t);
            if (type.equals(Datasource.REMOTE_TYPE)) {
                try {
                    return new Datasource(type, path, RemoteDescriptor.parse(path));
                } catch (IllegalArgumentException e) {
                    throw error("Invalid remote descriptor: " + e.getMessage(), t);
                }
            }
            return Datasource.of(type, path);
        }

        // ---- INSERT / UPDATE / DELETE ----

        private InsertStatement insert() {
            expect(TokenType.INSERT, "INSERT");
            expect(TokenType.INTO, "INTO");
            Datasource target = datasource(expect(TokenType.DATASOURCE, "datasource after INTO"));
            List<ColumnRef> columns = List.of();
            if (accept(TokenType.LPAREN)) {
                columns = columnList();
                expect(TokenType.RPAREN, "')' after column list");
            }
            expect(TokenType.VALUES, "VALUES");
            List<List<Object>> rows = new ArrayList<>();
            int arity = columns.isEmpty() ? -1 : columns.size();
            do {
                Token open = expect(TokenType.LPAREN, "'(' to start a row");
                List<Object> row = new ArrayList<>();
                do {
                    row.add(literal());
                } while (accept(TokenType.COMMA));
                expect(TokenType.RPAREN, "')' to close a row");
                if (arity < 0) arity = row.size();
                if (row.size() != arity) {
                    throw error("Row has " + row.size() + " values but " + arity + " are expected", open);
                }
                rows.add(row);
            } while (accept(TokenType.COMMA));
            return new InsertStatement(target, columns, rows);
        }

        private UpdateStatement update() {
            expect(TokenType.UPDATE, "UPDATE");
            Datasource target = datasource(expect(TokenType.DATASOURCE, "datasource after UPDATE"));
            expect(TokenType.SET, "SET");
            List<Assignment> assigns = new ArrayList<>();
            do {
                ColumnRef col = column();
                expect(TokenType.EQUAL, "'=' in assignment");
                assigns.add(new Assignment(col, literal()));
            } while (accept(TokenType.COMMA));
            Condition where = accept(TokenType.WHERE) ? condition() : null;
            return new UpdateStatement(target, assigns, where);
        }

        private DeleteStatement delete() {
            expect(TokenType.DELETE, "DELETE");
            expect(TokenType.FROM, "FROM");
            Datasource target = datasource(expect(TokenType.DATASOURCE, "datasource after FROM"));
            Condition where = accept(TokenType.WHERE) ? condition() : null;
            return new DeleteStatement(target, where);
        }

        // ---- cursor ----

        private Token peek() {
            return tokens.get(Math.min(pos, tokens.size() - 1));
        }

        private Token advance() {
            Token t = peek();
            if (!t.is(TokenType.EOF)) pos++;
            return t;
        }

        private boolean accept(TokenType type) {
            if (peek().is(type)) {
                pos++;
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String what) {
            Token t = peek();
            if (!t.is(type)) throw error("Expected " + what, t);
            if (!t.is(TokenType.EOF)) pos++;
            return t;
        }

        private static SyntaxException error(String message, Token t) {
            return new SyntaxException(message, t.text(), t.line(), t.column());
        }
    }
}
