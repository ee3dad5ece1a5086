package entitygc.jdbc.store;

import entitygc.jdbc.GraphTables;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC graph stores with auto-detection support.
 *
 * <p>Graph stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/entitygc.jdbc.store.AbstractJdbcGraphStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcGraphStore store = JdbcGraphStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcGraphStore store = JdbcGraphStores.detect("jdbc:postgresql://localhost/catalog");
 *
 * // Get by name, with custom tables
 * AbstractJdbcGraphStore store = JdbcGraphStores.get("mysql")
 *     .withConfig(new GraphTables("refresh_state", "final_entities", "refresh_state_references"), 1000);
 * }</pre>
 */
public final class JdbcGraphStores {

  private static final List<AbstractJdbcGraphStore> STORES;
  private static final Map<String, AbstractJdbcGraphStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcGraphStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcGraphStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcGraphStores() {
  }

  /**
   * Returns all registered graph stores.
   */
  public static List<AbstractJdbcGraphStore> all() {
    return STORES;
  }

  /**
   * Gets a graph store by name.
   *
   * @param name graph store name (case-insensitive)
   * @return the graph store
   * @throws IllegalArgumentException if no graph store found
   */
  public static AbstractJdbcGraphStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcGraphStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown graph store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects graph store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected graph store
   * @throws IllegalStateException if detection fails or no matching graph store
   */
  public static AbstractJdbcGraphStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect graph store from DataSource", e);
    }
  }

  /**
   * Auto-detects graph store from a DataSource and applies custom tables and chunk size.
   *
   * @param dataSource the data source
   * @param tables     table names
   * @param batchSize  maximum references per statement
   * @return detected graph store configured with the given tables
   */
  public static AbstractJdbcGraphStore detect(DataSource dataSource, GraphTables tables, int batchSize) {
    Objects.requireNonNull(tables, "tables");
    return detect(dataSource).withConfig(tables, batchSize);
  }

  /**
   * Auto-detects graph store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected graph store
   * @throws IllegalArgumentException if no matching graph store found
   */
  public static AbstractJdbcGraphStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    for (AbstractJdbcGraphStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No graph store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
