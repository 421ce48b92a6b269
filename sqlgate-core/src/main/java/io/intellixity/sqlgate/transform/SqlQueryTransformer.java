package io.intellixity.sqlgate.transform;

import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.error.ReadOnlyViolationException;
import io.intellixity.sqlgate.error.TableAccessException;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.operators.conditional.XorExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Fetch;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.Top;
import net.sf.jsqlparser.statement.select.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wraps one parsed statement and rewrites it in place for safe, bounded execution.
 * <p>
 * Construction parses eagerly and fails with {@link io.intellixity.sqlgate.error.InvalidSqlException}.
 * Rewriting methods return {@code this} so calls chain; rendering always uses the dialect
 * fixed at construction. Instances are single-request and not thread-safe.
 */
public final class SqlQueryTransformer {
  private static final Logger log = LoggerFactory.getLogger(SqlQueryTransformer.class);

  static final String COUNT_ALIAS = "count_subquery";
  static final String ZERO_COUNT_QUERY = "SELECT 0";

  private static final String COUNT_TEMPLATE = "SELECT COUNT(*) FROM (SELECT 1) AS " + COUNT_ALIAS;
  private static final String OFFSET_FETCH_TEMPLATE =
      "SELECT 1 ORDER BY (SELECT NULL) OFFSET 0 ROWS FETCH NEXT 1 ROWS ONLY";

  private final SqlDialect dialect;
  private final Statement statement;

  public SqlQueryTransformer(String sql) {
    this(sql, (SqlDialect) null);
  }

  public SqlQueryTransformer(String sql, String dialectName) {
    this(sql, SqlDialect.fromName(dialectName));
  }

  public SqlQueryTransformer(String sql, SqlDialect dialect) {
    this.dialect = dialect == null ? SqlDialect.GENERIC : dialect;
    this.statement = SqlParsing.parse(sql, this.dialect);
  }

  public SqlDialect dialect() { return dialect; }

  public boolean isReadOnly() {
    return !StatementInspector.inspect(statement).mutating();
  }

  public SqlQueryTransformer validateReadOnly() {
    if (!isReadOnly()) throw new ReadOnlyViolationException("Query contains non-SELECT operations");
    return this;
  }

  public SqlQueryTransformer addPagination(long limit) {
    return addPagination(limit, 0);
  }

  /**
   * Bounds the top-level query to {@code limit} rows starting at {@code offset}.
   * An existing top-level limit smaller than {@code limit} is kept. Nested queries are untouched.
   */
  public SqlQueryTransformer addPagination(long limit, long offset) {
    PaginationWindow window = new PaginationWindow(limit, offset);
    Select select = topLevelQuery();
    if (select == null) return this;

    if (dialect.paginationStyle() == SqlDialect.PaginationStyle.TOP_OR_OFFSET_FETCH) {
      applyTopOrOffsetFetch(select, window);
    } else {
      applyLimitOffset(select, window);
    }
    if (log.isDebugEnabled()) {
      log.debug("sqlgate.rewrite op=pagination dialect={} limit={} offset={}",
          dialect.id(), window.limit(), window.offset());
    }
    return this;
  }

  /**
   * Renders {@code SELECT COUNT(*) FROM (<query without its top-level window>) AS count_subquery}.
   * The WITH clause moves to the outer statement. The transformer's own statement is not modified.
   */
  public String toCountQuery() {
    if (topLevelQuery() == null) return ZERO_COUNT_QUERY;

    Select body = (Select) SqlParsing.parse(statement.toString(), dialect);
    List<WithItem<?>> withItems = body.getWithItemsList();
    body.setWithItemsList(null);
    stripWindow(body);
    if (dialect == SqlDialect.MSSQL) {
      // derived tables may not carry ORDER BY on SQL Server
      body.setOrderByElements(null);
    }

    PlainSelect count = (PlainSelect) SqlParsing.parse(COUNT_TEMPLATE, dialect);
    ((ParenthesedSelect) count.getFromItem()).setSelect(body);
    if (withItems != null && !withItems.isEmpty()) count.setWithItemsList(withItems);
    return count.toString();
  }

  /** ANDs a WHERE fragment into the top-level SELECT. The fragment is parsed even when it is not applied. */
  public SqlQueryTransformer addWhereCondition(String conditionText) {
    Expression condition = SqlParsing.parseCondition(conditionText, dialect);
    if (!(statement instanceof PlainSelect plain)) return this;

    Expression where = plain.getWhere();
    plain.setWhere(where == null ? condition : new AndExpression(grouped(where), grouped(condition)));
    if (log.isDebugEnabled()) log.debug("sqlgate.rewrite op=where dialect={} condition={}", dialect.id(), condition);
    return this;
  }

  /**
   * Checks every referenced table against the given policy sets (case-insensitive).
   * A null or empty set is treated as absent.
   */
  public SqlQueryTransformer validateTableAccess(Collection<String> allowed, Collection<String> disallowed) {
    Set<String> allow = folded(allowed);
    Set<String> deny = folded(disallowed);
    if (allow == null && deny == null) return this;

    for (Map.Entry<String, String> t : referencedTables().entrySet()) {
      if (allow != null && !allow.contains(t.getKey())) {
        throw new TableAccessException("Table '" + t.getValue() + "' is not in the allowed list");
      }
      if (deny != null && deny.contains(t.getKey())) {
        throw new TableAccessException("Table '" + t.getValue() + "' is in the excluded list");
      }
    }
    return this;
  }

  /** Case-folded unqualified table name to the name as written, in first-seen order. */
  public Map<String, String> referencedTables() {
    return StatementInspector.inspect(statement).tables();
  }

  public String sql() {
    return statement.toString();
  }

  @Override
  public String toString() {
    return sql();
  }

  private Select topLevelQuery() {
    if (statement instanceof PlainSelect
        || statement instanceof SetOperationList
        || statement instanceof ParenthesedSelect) {
      return (Select) statement;
    }
    return null;
  }

  private static void applyLimitOffset(Select select, PaginationWindow window) {
    Limit existing = select.getLimit();
    Fetch fetch = select.getFetch();
    boolean hadOffset = select.getOffset() != null || (existing != null && existing.getOffset() != null);

    if (existing == null && fetch != null) {
      // standard FETCH FIRST n ROWS ONLY already bounds the query; tighten it in place
      fetch.setExpression(new LongValue(effectiveLimit(rowCount(fetch.getExpression()), window)));
    } else {
      Limit limit = new Limit();
      limit.setRowCount(new LongValue(effectiveLimit(existing == null ? null : rowCount(existing.getRowCount()), window)));
      select.setLimit(limit);
    }

    if (hadOffset || window.offset() > 0) {
      Offset offset = select.getOffset() != null ? select.getOffset() : new Offset();
      offset.setOffset(new LongValue(window.offset()));
      select.setOffset(offset);
    }
  }

  private void applyTopOrOffsetFetch(Select select, PaginationWindow window) {
    PlainSelect plain = select instanceof PlainSelect p ? p : null;
    Top top = plain == null ? null : plain.getTop();
    Long existing = null;
    if (top != null && !top.isPercentage()) existing = rowCount(top.getExpression());
    if (select.getFetch() != null) existing = min(existing, rowCount(select.getFetch().getExpression()));
    if (select.getLimit() != null) existing = min(existing, rowCount(select.getLimit().getRowCount()));
    long rows = effectiveLimit(existing, window);
    boolean useOffset = select.getOffset() != null || window.offset() > 0;

    select.setLimit(null);
    if (!useOffset && plain != null && select.getFetch() == null) {
      Top bounded = new Top();
      bounded.setExpression(new LongValue(rows));
      plain.setTop(bounded);
      return;
    }

    if (plain != null) plain.setTop(null);
    PlainSelect template = (PlainSelect) SqlParsing.parse(OFFSET_FETCH_TEMPLATE, dialect);
    if (select.getOrderByElements() == null || select.getOrderByElements().isEmpty()) {
      select.setOrderByElements(template.getOrderByElements());
    }
    Offset offset = select.getOffset() != null ? select.getOffset() : template.getOffset();
    offset.setOffset(new LongValue(window.offset()));
    select.setOffset(offset);
    Fetch fetch = select.getFetch() != null ? select.getFetch() : template.getFetch();
    fetch.setExpression(new LongValue(rows));
    select.setFetch(fetch);
  }

  private static void stripWindow(Select select) {
    select.setLimit(null);
    select.setOffset(null);
    select.setFetch(null);
    if (select instanceof PlainSelect plain) plain.setTop(null);
  }

  private static long effectiveLimit(Long existing, PaginationWindow window) {
    return existing != null && existing <= window.limit() ? existing : window.limit();
  }

  private static Long min(Long a, Long b) {
    if (a == null) return b;
    if (b == null) return a;
    return Math.min(a, b);
  }

  /** Literal row count, or null for ALL, parameters and expressions. */
  private static Long rowCount(Expression e) {
    return e instanceof LongValue lv ? lv.getValue() : null;
  }

  private static Expression grouped(Expression e) {
    return hasUngroupedDisjunction(e) ? new ParenthesedExpressionList<>(e) : e;
  }

  /**
   * True when an OR/XOR sits anywhere outside parentheses, including inside the operands of
   * IN, BETWEEN or NOT where the parser may have attached a trailing disjunction.
   */
  static boolean hasUngroupedDisjunction(Expression e) {
    if (e == null || e instanceof ParenthesedExpressionList || e instanceof Select) return false;
    if (e instanceof OrExpression || e instanceof XorExpression) return true;
    if (e instanceof BinaryExpression b) {
      return hasUngroupedDisjunction(b.getLeftExpression()) || hasUngroupedDisjunction(b.getRightExpression());
    }
    if (e instanceof InExpression in) {
      return hasUngroupedDisjunction(in.getLeftExpression()) || hasUngroupedDisjunction(in.getRightExpression());
    }
    if (e instanceof Between between) {
      return hasUngroupedDisjunction(between.getLeftExpression())
          || hasUngroupedDisjunction(between.getBetweenExpressionStart())
          || hasUngroupedDisjunction(between.getBetweenExpressionEnd());
    }
    if (e instanceof NotExpression not) return hasUngroupedDisjunction(not.getExpression());
    if (e instanceof IsNullExpression isNull) return hasUngroupedDisjunction(isNull.getLeftExpression());
    return false;
  }

  private static Set<String> folded(Collection<String> names) {
    if (names == null || names.isEmpty()) return null;
    return names.stream()
        .filter(Objects::nonNull)
        .map(StatementInspector::normalize)
        .collect(Collectors.toSet());
  }
}
