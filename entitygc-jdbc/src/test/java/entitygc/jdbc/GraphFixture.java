package entitygc.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Seeds and inspects the entity graph tables in tests.
 */
public final class GraphFixture {
  public static final String ORIGINAL = "original";
  private static final Timestamp SCHEDULED = Timestamp.from(Instant.parse("2021-04-01T13:37:00Z"));

  private final DataSource dataSource;
  private final GraphTables tables;

  public GraphFixture(DataSource dataSource) {
    this(dataSource, GraphTables.defaults());
  }

  public GraphFixture(DataSource dataSource, GraphTables tables) {
    this.dataSource = dataSource;
    this.tables = tables;
  }

  /** Creates the H2 schema under the given table names and returns a fixture for it. */
  public static GraphFixture createH2(DataSource dataSource, GraphTables tables) throws SQLException {
    applySchema(dataSource, "/schema/h2.sql", renameTables(tables));
    return new GraphFixture(dataSource, tables);
  }

  public static void applySchema(DataSource dataSource, String resource) throws SQLException {
    applySchema(dataSource, resource, UnaryOperator.identity());
  }

  public static void applySchema(DataSource dataSource, String resource, UnaryOperator<String> rewrite)
      throws SQLException {
    String schema = rewrite.apply(loadResource(resource));
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String ddl : schema.split(";")) {
        String trimmed = ddl.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  /** Rewrites the default table names in a schema script. */
  public static UnaryOperator<String> renameTables(GraphTables tables) {
    return ddl -> ddl
        .replaceAll("\\bfinal_entities\\b", tables.finalEntities())
        .replaceAll("\\breference_edges\\b", tables.referenceEdges())
        .replaceAll("\\bentities\\b", tables.entities());
  }

  public void entities(String... refs) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      for (String ref : refs) {
        String entityId = UUID.randomUUID().toString();
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO " + tables.entities() + " (entity_id, entity_ref, unprocessed_entity," +
                " processed_entity, errors, next_update_at, last_discovery_at, result_hash)" +
                " VALUES (?,?,?,?,?,?,?,?)")) {
          ps.setString(1, entityId);
          ps.setString(2, ref);
          ps.setString(3, "{}");
          ps.setString(4, "{}");
          ps.setString(5, "[]");
          ps.setTimestamp(6, SCHEDULED);
          ps.setTimestamp(7, SCHEDULED);
          ps.setString(8, ORIGINAL);
          ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO " + tables.finalEntities() + " (entity_id, hash, stitch_ticket) VALUES (?,?,?)")) {
          ps.setString(1, entityId);
          ps.setString(2, ORIGINAL);
          ps.setString(3, "");
          ps.executeUpdate();
        }
      }
    }
  }

  public void root(String sourceKey, String target) throws SQLException {
    insertEdge(sourceKey, null, target);
  }

  public void edge(String source, String target) throws SQLException {
    insertEdge(null, source, target);
  }

  private void insertEdge(String sourceKey, String sourceRef, String target) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "INSERT INTO " + tables.referenceEdges() +
                 " (source_key, source_entity_ref, target_entity_ref) VALUES (?,?,?)")) {
      conn.setAutoCommit(true);
      ps.setString(1, sourceKey);
      ps.setString(2, sourceRef);
      ps.setString(3, target);
      ps.executeUpdate();
    }
  }

  /** entity_ref to result_hash, ordered by entity_ref. */
  public Map<String, String> resultHashes() throws SQLException {
    return stringMap("SELECT entity_ref, result_hash FROM " + tables.entities() +
        " ORDER BY entity_ref");
  }

  /** entity_ref to final hash, ordered by entity_ref. */
  public Map<String, String> finalHashes() throws SQLException {
    return stringMap("SELECT e.entity_ref, f.hash FROM " + tables.finalEntities() + " f" +
        " JOIN " + tables.entities() + " e ON f.entity_id = e.entity_id ORDER BY e.entity_ref");
  }

  public Set<String> flagged() throws SQLException {
    return stringMap("SELECT entity_ref, entity_ref FROM " + tables.entities() +
        " WHERE needs_reprocessing = TRUE").keySet();
  }

  public int finalEntityCount() throws SQLException {
    return count("SELECT COUNT(*) FROM " + tables.finalEntities());
  }

  public int edgeCount() throws SQLException {
    return count("SELECT COUNT(*) FROM " + tables.referenceEdges());
  }

  public int edgesFrom(String source) throws SQLException {
    return count("SELECT COUNT(*) FROM " + tables.referenceEdges() +
        " WHERE source_entity_ref = '" + source + "'");
  }

  public void clear() throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM " + tables.referenceEdges());
      stmt.execute("DELETE FROM " + tables.finalEntities());
      stmt.execute("DELETE FROM " + tables.entities());
    }
  }

  private Map<String, String> stringMap(String sql) throws SQLException {
    Map<String, String> rows = new LinkedHashMap<>();
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      while (rs.next()) {
        rows.put(rs.getString(1), rs.getString(2));
      }
    }
    return rows;
  }

  private int count(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  public Set<String> entityRefs() throws SQLException {
    return new TreeSet<>(resultHashes().keySet());
  }

  private static String loadResource(String path) {
    try (InputStream in = GraphFixture.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalStateException("Missing resource: " + path);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
