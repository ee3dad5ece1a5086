package entitygc.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import entitygc.jdbc.store.AbstractJdbcGraphStore;
import entitygc.jdbc.store.H2GraphStore;
import entitygc.jdbc.store.MySqlGraphStore;
import entitygc.jdbc.store.PostgresGraphStore;
import entitygc.model.ReferenceEdge;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Creates a {@link DatabaseSetup} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"}, and {@code "postgresql"} (external servers).
 * External database connection details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}: default {@code jdbc:mysql://localhost:3306/entitygc_bench}</li>
 *   <li>{@code bench.mysql.user}: default {@code root}</li>
 *   <li>{@code bench.mysql.password}: default {@code ""} (empty)</li>
 *   <li>{@code bench.pg.url}: default {@code jdbc:postgresql://localhost:5432/entitygc_bench}</li>
 *   <li>{@code bench.pg.user}: default {@code postgres}</li>
 *   <li>{@code bench.pg.password}: default {@code postgres}</li>
 * </ul>
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(DataSource dataSource, AbstractJdbcGraphStore store) {}

  static DatabaseSetup create(String database) {
    return switch (database) {
      case "h2" -> createH2();
      case "mysql" -> createExternal(
          System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/entitygc_bench"),
          System.getProperty("bench.mysql.user", "root"),
          System.getProperty("bench.mysql.password", ""),
          "/schema/mysql.sql", "bench-mysql", new MySqlGraphStore());
      case "postgresql" -> createExternal(
          System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/entitygc_bench"),
          System.getProperty("bench.pg.user", "postgres"),
          System.getProperty("bench.pg.password", "postgres"),
          "/schema/postgresql.sql", "bench-pg", new PostgresGraphStore());
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    };
  }

  private static DatabaseSetup createH2() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:bench_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    applySchema(ds, "/schema/h2.sql");
    return new DatabaseSetup(ds, new H2GraphStore());
  }

  private static DatabaseSetup createExternal(String url, String user, String password,
      String schema, String poolName, AbstractJdbcGraphStore store) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName(poolName);
    config.setMaximumPoolSize(4);
    config.setMinimumIdle(1);
    HikariDataSource ds = new HikariDataSource(config);
    applySchema(ds, schema);
    return new DatabaseSetup(ds, store);
  }

  private static void applySchema(DataSource ds, String resource) {
    String ddl;
    try (InputStream in = BenchmarkDataSourceFactory.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource " + resource);
      }
      ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : ddl.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
  }

  /** Replaces the contents of the graph tables with {@code graph}. */
  static void load(DataSource ds, BenchmarkGraph graph) {
    try (Connection conn = ds.getConnection()) {
      conn.setAutoCommit(false);
      try (Statement stmt = conn.createStatement()) {
        stmt.execute("DELETE FROM reference_edges");
        stmt.execute("DELETE FROM final_entities");
        stmt.execute("DELETE FROM entities");
      }
      try (PreparedStatement entity = conn.prepareStatement(
              "INSERT INTO entities (entity_id, entity_ref, result_hash) VALUES (?, ?, 'bench')");
           PreparedStatement fin = conn.prepareStatement(
              "INSERT INTO final_entities (entity_id, hash) VALUES (?, 'bench')")) {
        for (String ref : graph.entityRefs()) {
          String id = UUID.randomUUID().toString();
          entity.setString(1, id);
          entity.setString(2, ref);
          entity.addBatch();
          fin.setString(1, id);
          fin.addBatch();
        }
        entity.executeBatch();
        fin.executeBatch();
      }
      try (PreparedStatement edge = conn.prepareStatement(
          "INSERT INTO reference_edges (source_key, source_entity_ref, target_entity_ref) VALUES (?, ?, ?)")) {
        for (ReferenceEdge e : graph.edges()) {
          edge.setString(1, e.sourceKey());
          edge.setString(2, e.sourceEntityRef());
          edge.setString(3, e.targetEntityRef());
          edge.addBatch();
        }
        edge.executeBatch();
      }
      conn.commit();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load benchmark graph", e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
