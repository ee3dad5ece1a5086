/**
 * Manual JDBC transaction management.
 *
 * <p>{@link entitygc.jdbc.tx.JdbcTransactionManager} provides a lightweight
 * try-with-resources API for running a sweep in its own transaction, with
 * {@link entitygc.jdbc.tx.ThreadLocalTxContext} exposing the bound connection.
 *
 * @see entitygc.jdbc.tx.JdbcTransactionManager
 * @see entitygc.jdbc.tx.ThreadLocalTxContext
 */
package entitygc.jdbc.tx;
