package io.intellixity.vellum.jobs.exec;

import io.intellixity.vellum.jobs.RetryJobException;
import io.intellixity.vellum.jobs.TransientStorageException;

import java.sql.SQLException;
import java.sql.SQLTransactionRollbackException;
import java.util.Set;

/**
 * Classifies job failures worth another attempt: explicit retry requests, deadlocks and lock wait
 * timeouts, anywhere in the cause chain.
 */
public final class RetryableErrors {
  /** Serialization failure, deadlock (Postgres), lock not available. */
  private static final Set<String> SQL_STATES = Set.of("40001", "40P01", "55P03");
  /** MySQL / MariaDB deadlock and lock wait timeout. */
  private static final Set<Integer> VENDOR_CODES = Set.of(1213, 1205);
  private static final int MAX_DEPTH = 16;

  private RetryableErrors() {}

  public static boolean isRetryable(Throwable error) {
    Throwable t = error;
    for (int depth = 0; t != null && depth < MAX_DEPTH; depth++) {
      if (t instanceof RetryJobException || t instanceof TransientStorageException) return true;
      if (t instanceof SQLTransactionRollbackException) return true;
      if (t instanceof SQLException sql && isLockConflict(sql)) return true;
      if (t.getCause() == t) break;
      t = t.getCause();
    }
    return false;
  }

  static boolean isLockConflict(SQLException e) {
    return (e.getSQLState() != null && SQL_STATES.contains(e.getSQLState()))
        || VENDOR_CODES.contains(e.getErrorCode());
  }
}
