package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.exec.QueryResult;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Materializes a {@link ResultSet} into a {@link QueryResult}, keeping projection order. */
final class JdbcResultReader {
  private JdbcResultReader() {}

  static QueryResult read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> columns = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) columns.add(md.getColumnLabel(i));

    List<List<Object>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Object> row = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) row.add(scalar(rs.getObject(i)));
      rows.add(row);
    }
    return new QueryResult(columns, rows);
  }

  private static Object scalar(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof Clob c) return c.getSubString(1, (int) Math.min(Integer.MAX_VALUE, c.length()));
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return String.valueOf(arr);
    }
    if (v instanceof BigDecimal bd && bd.scale() <= 0) {
      try {
        return bd.longValueExact();
      } catch (ArithmeticException tooLarge) {
        return bd;
      }
    }
    return v;
  }
}
