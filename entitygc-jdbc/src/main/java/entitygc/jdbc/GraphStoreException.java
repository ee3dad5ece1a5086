package entitygc.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link entitygc.jdbc.store.AbstractJdbcGraphStore} and its subclasses.
 *
 * <p>The enclosing transaction must be rolled back; nothing is retried here.
 */
public final class GraphStoreException extends RuntimeException {
  public GraphStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
