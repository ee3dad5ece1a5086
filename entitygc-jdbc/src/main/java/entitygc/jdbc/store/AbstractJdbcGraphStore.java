package entitygc.jdbc.store;

import entitygc.jdbc.GraphTables;
import entitygc.jdbc.JdbcTemplate;
import entitygc.model.GraphSnapshot;
import entitygc.model.ReferenceEdge;
import entitygc.model.ReprocessingSignal;
import entitygc.spi.GraphStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC graph store with portable SQL.
 *
 * <p>Statements that take a list of entity references are issued once per
 * chunk of at most {@code batchSize} references, so statement size stays
 * bounded however many orphans a sweep finds. Subclasses override
 * {@link #refCondition} and {@link #refParams} to change how a chunk is bound,
 * and the {@code delete*}/{@code mark*} hooks where the database has better syntax.
 * A chunk is bound once and the same parameters are passed to every statement
 * issued for it; {@link #releaseParams} runs after the last one.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/entitygc.jdbc.store.AbstractJdbcGraphStore}.
 *
 * @see JdbcGraphStores
 */
public abstract class AbstractJdbcGraphStore implements GraphStore {
  public static final int DEFAULT_BATCH_SIZE = 500;

  private static final JdbcTemplate.RowMapper<ReferenceEdge> EDGE_ROW_MAPPER = rs -> new ReferenceEdge(
      rs.getString("source_key"),
      rs.getString("source_entity_ref"),
      rs.getString("target_entity_ref"));

  private final GraphTables tables;
  private final int batchSize;

  protected AbstractJdbcGraphStore() {
    this(GraphTables.defaults(), DEFAULT_BATCH_SIZE);
  }

  protected AbstractJdbcGraphStore(GraphTables tables, int batchSize) {
    this.tables = Objects.requireNonNull(tables, "tables");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = batchSize;
  }

  /**
   * Unique identifier for this graph store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this graph store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind using different tables or chunk size.
   */
  public abstract AbstractJdbcGraphStore withConfig(GraphTables tables, int batchSize);

  public GraphTables tables() {
    return tables;
  }

  public int batchSize() {
    return batchSize;
  }

  @Override
  public GraphSnapshot loadSnapshot(Connection conn) {
    List<String> entityRefs = JdbcTemplate.query(conn,
        "SELECT entity_ref FROM " + tables.entities(),
        rs -> rs.getString(1));
    List<ReferenceEdge> edges = JdbcTemplate.query(conn,
        "SELECT source_key, source_entity_ref, target_entity_ref FROM " + tables.referenceEdges(),
        EDGE_ROW_MAPPER);
    return GraphSnapshot.of(entityRefs, edges);
  }

  @Override
  public int deleteEntities(Connection conn, Collection<String> entityRefs) {
    return forEachChunk(conn, entityRefs, (count, params) -> {
      deleteFinalEntities(conn, count, params);
      return deleteEntityRows(conn, count, params);
    });
  }

  @Override
  public int markForReprocessing(Connection conn, Collection<String> entityRefs,
      ReprocessingSignal signal) {
    Objects.requireNonNull(signal, "signal");
    return forEachChunk(conn, entityRefs, (count, params) -> switch (signal) {
      case FLAG -> markFlag(conn, count, params);
      case SENTINEL_HASH -> markSentinel(conn, count, params);
    });
  }

  @Override
  public int pruneEdgesFrom(Connection conn, Collection<String> sourceEntityRefs) {
    return forEachChunk(conn, sourceEntityRefs, (count, params) -> {
      String sql = "DELETE FROM " + tables.referenceEdges() +
          " WHERE " + refCondition("source_entity_ref", count);
      return JdbcTemplate.update(conn, sql, params);
    });
  }

  /**
   * Deletes the final entity rows belonging to a chunk of {@code count} references
   * bound as {@code params}.
   */
  protected int deleteFinalEntities(Connection conn, int count, Object[] params) {
    String sql = "DELETE FROM " + tables.finalEntities() +
        " WHERE entity_id IN (SELECT entity_id FROM " + tables.entities() +
        " WHERE " + refCondition("entity_ref", count) + ")";
    return JdbcTemplate.update(conn, sql, params);
  }

  /** Deletes the entity rows of a chunk, returning the number removed. */
  protected int deleteEntityRows(Connection conn, int count, Object[] params) {
    String sql = "DELETE FROM " + tables.entities() +
        " WHERE " + refCondition("entity_ref", count);
    return JdbcTemplate.update(conn, sql, params);
  }

  /** Sets {@code needs_reprocessing}; rows already flagged are not counted. */
  protected int markFlag(Connection conn, int count, Object[] params) {
    String sql = "UPDATE " + tables.entities() + " SET needs_reprocessing = ?" +
        " WHERE needs_reprocessing = ? AND " + refCondition("entity_ref", count);
    return JdbcTemplate.update(conn, sql, prepend(params, Boolean.TRUE, Boolean.FALSE));
  }

  /** Writes the sentinel fingerprint to both tables; returns changed entity rows. */
  protected int markSentinel(Connection conn, int count, Object[] params) {
    String sentinel = ReprocessingSignal.SENTINEL_HASH_VALUE;
    String finalSql = "UPDATE " + tables.finalEntities() + " SET hash = ?" +
        " WHERE entity_id IN (SELECT entity_id FROM " + tables.entities() +
        " WHERE " + refCondition("entity_ref", count) + ")";
    JdbcTemplate.update(conn, finalSql, prepend(params, sentinel));

    String entitySql = "UPDATE " + tables.entities() + " SET result_hash = ?" +
        " WHERE (result_hash IS NULL OR result_hash <> ?) AND " +
        refCondition("entity_ref", count);
    return JdbcTemplate.update(conn, entitySql, prepend(params, sentinel, sentinel));
  }

  /**
   * SQL predicate matching {@code column} against a chunk of {@code count} references.
   * Default: {@code column IN (?, ?, ...)}.
   */
  protected String refCondition(String column, int count) {
    return column + " IN (" + String.join(",", Collections.nCopies(count, "?")) + ")";
  }

  /**
   * Bind parameters matching {@link #refCondition}. Default: one parameter per reference.
   */
  protected Object[] refParams(Connection conn, List<String> refs) {
    return refs.toArray();
  }

  /**
   * Releases resources held by parameters from {@link #refParams} once every
   * statement of the chunk has run. Default: nothing to release.
   */
  protected void releaseParams(Object[] params) {
  }

  protected static Object[] prepend(Object[] params, Object... leading) {
    Object[] all = new Object[leading.length + params.length];
    System.arraycopy(leading, 0, all, 0, leading.length);
    System.arraycopy(params, 0, all, leading.length, params.length);
    return all;
  }

  @FunctionalInterface
  private interface ChunkStatement {
    int execute(int count, Object[] params);
  }

  /**
   * Binds each chunk once, runs {@code statement} with it and releases the binding.
   * Returns the sum of the statement results.
   */
  private int forEachChunk(Connection conn, Collection<String> refs, ChunkStatement statement) {
    int total = 0;
    for (List<String> chunk : chunks(refs)) {
      Object[] params = refParams(conn, chunk);
      try {
        total += statement.execute(chunk.size(), params);
      } catch (RuntimeException e) {
        try {
          releaseParams(params);
        } catch (RuntimeException releaseError) {
          e.addSuppressed(releaseError);
        }
        throw e;
      }
      releaseParams(params);
    }
    return total;
  }

  private List<List<String>> chunks(Collection<String> refs) {
    List<List<String>> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>(Math.min(batchSize, refs.size()));
    for (String ref : refs) {
      current.add(ref);
      if (current.size() == batchSize) {
        chunks.add(current);
        current = new ArrayList<>(batchSize);
      }
    }
    if (!current.isEmpty()) {
      chunks.add(current);
    }
    return chunks;
  }
}
