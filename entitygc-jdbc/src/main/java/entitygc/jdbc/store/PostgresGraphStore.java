package entitygc.jdbc.store;

import entitygc.jdbc.GraphStoreException;
import entitygc.jdbc.GraphTables;

import java.sql.Array;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL graph store.
 *
 * <p>Binds each chunk of references as a single {@code varchar[]} parameter
 * ({@code column = ANY(?)}), so statement text is the same for every chunk and
 * the server can reuse its plan. The array is created once per chunk and
 * freed after the chunk's statements have run.
 */
public final class PostgresGraphStore extends AbstractJdbcGraphStore {

  public PostgresGraphStore() {
    super();
  }

  public PostgresGraphStore(GraphTables tables, int batchSize) {
    super(tables, batchSize);
  }

  @Override
  public AbstractJdbcGraphStore withConfig(GraphTables tables, int batchSize) {
    return new PostgresGraphStore(tables, batchSize);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String refCondition(String column, int count) {
    return column + " = ANY(?)";
  }

  @Override
  protected Object[] refParams(Connection conn, List<String> refs) {
    try {
      Array array = conn.createArrayOf("varchar", refs.toArray());
      return new Object[]{array};
    } catch (SQLException e) {
      throw new GraphStoreException("Failed to bind entity references as array", e);
    }
  }

  @Override
  protected void releaseParams(Object[] params) {
    for (Object param : params) {
      if (param instanceof Array array) {
        try {
          array.free();
        } catch (SQLException e) {
          throw new GraphStoreException("Failed to free entity reference array", e);
        }
      }
    }
  }
}
