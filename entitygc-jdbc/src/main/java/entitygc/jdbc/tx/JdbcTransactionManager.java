package entitygc.jdbc.tx;

import entitygc.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for callers that do not use Spring. Obtains a
 * connection, disables auto-commit, and binds it to a {@link ThreadLocalTxContext}.
 *
 * <pre>{@code
 * int deleted = txManager.inTransaction(conn -> collector.collect(conn));
 *
 * // or, explicitly
 * try (var tx = txManager.begin()) {
 *   int deleted = collector.collect();
 *   tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /** Work executed inside {@link #inTransaction}. */
  @FunctionalInterface
  public interface TxCallback<T> {
    T doInTransaction(Connection conn) throws SQLException;
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs {@code callback} in a new transaction, committing if it returns and
   * rolling back if it throws.
   *
   * @return the callback's result
   * @throws SQLException if the connection cannot be obtained, or commit fails
   */
  public <T> T inTransaction(TxCallback<T> callback) throws SQLException {
    Objects.requireNonNull(callback, "callback");
    try (Transaction tx = begin()) {
      T result = callback.doInTransaction(tx.connection());
      tx.commit();
      return result;
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException | RuntimeException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackError) {
          e.addSuppressed(rollbackError);
        }
        finish(false, e);
        throw e;
      }
      finish(true, null);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException | RuntimeException e) {
        finish(false, e);
        throw e;
      }
      finish(false, null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    /**
     * Runs the completion callbacks, then restores auto-commit and closes the connection.
     * Failures are attached to {@code primary} when there is one. After a successful
     * commit, a failure to reset or close the connection is logged, not thrown.
     */
    private void finish(boolean committed, Throwable primary) throws SQLException {
      Exception failure = null;
      try {
        if (committed) {
          txContext.clearAfterCommit();
        } else {
          txContext.clearAfterRollback();
        }
      } catch (RuntimeException e) {
        failure = e;
      }
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        failure = collect(failure, e);
      }
      try {
        connection.close();
      } catch (SQLException e) {
        failure = collect(failure, e);
      }

      if (failure == null) {
        return;
      }
      if (primary != null) {
        primary.addSuppressed(failure);
        return;
      }
      if (failure instanceof RuntimeException) {
        throw (RuntimeException) failure;
      }
      if (committed) {
        logger.log(Level.WARNING, "Transaction committed but connection cleanup failed", failure);
        return;
      }
      throw (SQLException) failure;
    }

    private static Exception collect(Exception first, Exception next) {
      if (first == null) {
        return next;
      }
      first.addSuppressed(next);
      return first;
    }
  }
}
