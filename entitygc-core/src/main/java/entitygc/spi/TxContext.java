package entitygc.spi;

import java.sql.Connection;

/**
 * Gives the collector access to the caller's transaction without tying it to a
 * particular transaction manager.
 *
 * <p>Implementations: {@code entitygc.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code entitygc.spring.SpringTxContext} (Spring-managed).
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @param callback action to execute post-commit
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);

  /**
   * Registers a callback to run after the current transaction rolls back.
   *
   * @param callback action to execute post-rollback
   * @throws IllegalStateException if no transaction is active
   */
  void afterRollback(Runnable callback);
}
