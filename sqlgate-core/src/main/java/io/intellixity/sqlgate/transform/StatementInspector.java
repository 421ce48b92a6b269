package io.intellixity.sqlgate.transform;

import net.sf.jsqlparser.expression.AnyComparisonExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.WindowDefinition;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.ParenthesedStatement;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.Distinct;
import net.sf.jsqlparser.statement.select.Fetch;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.LateralView;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.Values;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One pass over a parsed statement that records whether any part of it mutates data and
 * which physical tables it references.
 * <p>
 * Only queries are read-only: every top-level statement that is not a {@link Select}
 * counts as mutating, whatever its kind. Inside a query the walk covers CTE bodies, set
 * operations, derived tables, joins, table functions and subqueries found in any clause
 * (projection, DISTINCT ON, WHERE, GROUP BY, HAVING, WINDOW, QUALIFY, ORDER BY and the
 * row window). A CTE name hides a table only for unqualified references inside the CTE's
 * scope.
 */
final class StatementInspector {
  // one set of visible CTE names per WITH clause being walked
  private final Deque<Set<String>> cteScopes = new ArrayDeque<>();
  // normalized name -> name as written
  private final Map<String, String> tables = new LinkedHashMap<>();
  private boolean mutating;

  private final ExpressionVisitorAdapter<Void> subqueries = new ExpressionVisitorAdapter<>() {
    @Override
    public <S> Void visit(ParenthesedSelect select, S context) {
      walk(select);
      return null;
    }

    @Override
    public <S> Void visit(Select select, S context) {
      walk(select);
      return null;
    }

    @Override
    public <S> Void visit(AnyComparisonExpression any, S context) {
      walk(any.getSelect());
      return null;
    }
  };

  private StatementInspector() {}

  static StatementInspector inspect(Statement statement) {
    StatementInspector si = new StatementInspector();
    if (statement instanceof Select select) {
      si.walk(select);
    } else {
      si.mutating = true;
      si.collectDmlTarget(statement);
    }
    return si;
  }

  boolean mutating() { return mutating; }

  /** Referenced physical tables in first-seen order, CTE references excluded. Keys are case-folded. */
  Map<String, String> tables() {
    return new LinkedHashMap<>(tables);
  }

  static String normalize(String identifier) {
    return unquote(identifier).toLowerCase(Locale.ROOT);
  }

  static String unquote(String identifier) {
    if (identifier == null) return "";
    String n = identifier.strip();
    if (n.length() >= 2) {
      char first = n.charAt(0);
      char last = n.charAt(n.length() - 1);
      if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
        n = n.substring(1, n.length() - 1);
      }
    }
    return n;
  }

  private void collectDmlTarget(Statement statement) {
    if (statement instanceof Insert insert) {
      addTable(insert.getTable());
      walk(insert.getSelect());
    } else if (statement instanceof Update update) {
      addTable(update.getTable());
    } else if (statement instanceof Delete delete) {
      addTable(delete.getTable());
    }
  }

  private void walk(Select select) {
    if (select == null) return;
    List<WithItem<?>> withItems = select.getWithItemsList();
    boolean scoped = withItems != null && !withItems.isEmpty();
    if (scoped) {
      cteScopes.push(new HashSet<>());
      walkWithItems(withItems);
    }

    if (select instanceof PlainSelect plain) {
      walkPlain(plain);
    } else if (select instanceof SetOperationList setOps) {
      if (setOps.getSelects() != null) {
        for (Select s : setOps.getSelects()) walk(s);
      }
    } else if (select instanceof ParenthesedSelect parenthesed) {
      walk(parenthesed.getSelect());
    } else if (select instanceof Values values) {
      walkExpression(values.getExpressions());
    }
    walkOrderBy(select.getOrderByElements());
    walkWindow(select.getLimit(), select.getOffset(), select.getFetch());

    if (scoped) cteScopes.pop();
  }

  private void walkWithItems(List<WithItem<?>> withItems) {
    Set<String> scope = cteScopes.peek();
    for (WithItem<?> item : withItems) {
      if (item == null) continue;
      String alias = item.getAliasName() == null ? null : normalize(item.getAliasName());
      // a recursive CTE sees its own name; a plain one only sees earlier siblings
      if (alias != null && item.isRecursive()) scope.add(alias);
      ParenthesedStatement body = item.getParenthesedStatement();
      if (body instanceof ParenthesedSelect query) {
        walk(query);
      } else {
        // INSERT/UPDATE/DELETE ... RETURNING used as a CTE body
        mutating = true;
      }
      if (alias != null) scope.add(alias);
    }
  }

  private void walkPlain(PlainSelect plain) {
    if (plain.getIntoTables() != null && !plain.getIntoTables().isEmpty()) {
      // SELECT ... INTO creates a table
      mutating = true;
    }
    Distinct distinct = plain.getDistinct();
    if (distinct != null) walkSelectItems(distinct.getOnSelectItems());
    if (plain.getTop() != null) walkExpression(plain.getTop().getExpression());
    walkSelectItems(plain.getSelectItems());
    walkFrom(plain.getFromItem());
    walkJoins(plain.getJoins());
    if (plain.getLateralViews() != null) {
      for (LateralView view : plain.getLateralViews()) walkExpression(view.getGeneratorFunction());
    }
    walkExpression(plain.getWhere());
    walkExpression(plain.getOracleHierarchical());
    GroupByElement groupBy = plain.getGroupBy();
    if (groupBy != null) {
      walkExpression(groupBy.getGroupByExpressionList());
      if (groupBy.getGroupingSets() != null) {
        for (Object set : groupBy.getGroupingSets()) {
          if (set instanceof Expression e) walkExpression(e);
        }
      }
    }
    walkExpression(plain.getHaving());
    if (plain.getWindowDefinitions() != null) {
      for (WindowDefinition w : plain.getWindowDefinitions()) {
        walkExpression(w.getPartitionExpressionList());
        walkOrderBy(w.getOrderByElements());
      }
    }
    walkExpression(plain.getQualify());
  }

  private void walkSelectItems(List<SelectItem<?>> items) {
    if (items == null) return;
    for (SelectItem<?> item : items) walkExpression(item.getExpression());
  }

  private void walkOrderBy(List<OrderByElement> elements) {
    if (elements == null) return;
    for (OrderByElement e : elements) walkExpression(e.getExpression());
  }

  private void walkWindow(Limit limit, Offset offset, Fetch fetch) {
    if (limit != null) {
      walkExpression(limit.getRowCount());
      walkExpression(limit.getOffset());
    }
    if (offset != null) walkExpression(offset.getOffset());
    if (fetch != null) walkExpression(fetch.getExpression());
  }

  private void walkJoins(List<Join> joins) {
    if (joins == null) return;
    for (Join join : joins) {
      walkFrom(join.getRightItem());
      Collection<Expression> on = join.getOnExpressions();
      if (on != null) {
        for (Expression e : on) walkExpression(e);
      }
    }
  }

  private void walkFrom(FromItem item) {
    if (item == null) return;
    if (item instanceof Table table) {
      addTable(table);
    } else if (item instanceof Select select) {
      walk(select);
    } else if (item instanceof ParenthesedFromItem nested) {
      walkFrom(nested.getFromItem());
      walkJoins(nested.getJoins());
    } else if (item instanceof TableFunction function) {
      walkExpression(function.getFunction());
    }
  }

  private void walkExpression(Expression expression) {
    if (expression == null) return;
    expression.accept(subqueries);
  }

  private void addTable(Table table) {
    if (table == null || table.getName() == null) return;
    String written = unquote(table.getName());
    String key = written.toLowerCase(Locale.ROOT);
    if (table.getSchemaName() == null && isCteName(key)) return;
    tables.putIfAbsent(key, written);
  }

  private boolean isCteName(String key) {
    for (Set<String> scope : cteScopes) {
      if (scope.contains(key)) return true;
    }
    return false;
  }
}
