package io.intellixity.sqlgate.transform;

import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.error.InvalidSqlException;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParser;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** Thin binding to JSqlParser: dialect parser options and exception translation. */
final class SqlParsing {
  private SqlParsing() {}

  static Statement parse(String sql, SqlDialect dialect) {
    Objects.requireNonNull(sql, "sql");
    String text = sql.strip();
    if (text.isEmpty()) throw new InvalidSqlException("Invalid SQL query: empty statement");
    try {
      Statements parsed = CCJSqlParserUtil.parseStatements(text, options(dialect));
      List<Statement> statements = new ArrayList<>();
      if (parsed != null) {
        for (Statement st : parsed) {
          if (st != null) statements.add(st);
        }
      }
      if (statements.isEmpty()) throw new InvalidSqlException("Invalid SQL query: no statement found");
      if (statements.size() > 1) {
        throw new InvalidSqlException("Invalid SQL query: expected a single statement but found " + statements.size());
      }
      return statements.get(0);
    } catch (JSQLParserException e) {
      throw new InvalidSqlException("Invalid SQL query: " + describe(e), e);
    }
  }

  static Expression parseCondition(String condition, SqlDialect dialect) {
    Objects.requireNonNull(condition, "condition");
    String text = condition.strip();
    if (text.isEmpty()) throw new InvalidSqlException("Invalid SQL query: empty condition");
    try {
      return CCJSqlParserUtil.parseCondExpression(text, false, options(dialect));
    } catch (JSQLParserException e) {
      throw new InvalidSqlException("Invalid SQL query: " + describe(e), e);
    }
  }

  private static Consumer<CCJSqlParser> options(SqlDialect dialect) {
    boolean brackets = dialect.squareBracketIdentifiers();
    return parser -> parser.withSquareBracketQuotation(brackets);
  }

  // Parser messages span several lines (expected-token lists); the first one names the problem.
  private static String describe(JSQLParserException e) {
    Throwable source = e.getCause() != null ? e.getCause() : e;
    String msg = source.getMessage();
    if (msg == null || msg.isBlank()) return source.getClass().getSimpleName();
    int nl = msg.indexOf('\n');
    return (nl < 0 ? msg : msg.substring(0, nl)).strip();
  }
}
