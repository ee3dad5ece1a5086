package entitygc.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for callers that manage transactions by hand.
 *
 * <p>Callers are responsible for closing the returned connection.
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
