package io.intellixity.vellum.sql;

import java.util.List;
import java.util.Map;

/**
 * Executes rendered selects against the live datastore.
 *
 * @see io.intellixity.vellum.sql.jdbc.JdbcStatementRunner
 */
public interface StatementRunner {

  /** Rows keyed by column label, in select order. */
  List<Map<String, Object>> queryForMaps(SqlStatement statement);

  /** Rows as positional values, in select order. */
  List<List<Object>> queryForLists(SqlStatement statement);
}
