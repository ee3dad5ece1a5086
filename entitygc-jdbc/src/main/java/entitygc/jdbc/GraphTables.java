package entitygc.jdbc;

import java.util.Objects;

/**
 * Names of the three tables a graph store reads and writes.
 *
 * <p>Names are interpolated into SQL, so each must match
 * {@code [a-zA-Z_][a-zA-Z0-9_]*}.
 *
 * @param entities      table holding one row per entity
 * @param finalEntities table holding the stitched output, 1:1 with {@code entities}
 * @param referenceEdges table holding root and internal reference edges
 */
public record GraphTables(String entities, String finalEntities, String referenceEdges) {
  public static final String DEFAULT_ENTITIES = "entities";
  public static final String DEFAULT_FINAL_ENTITIES = "final_entities";
  public static final String DEFAULT_REFERENCE_EDGES = "reference_edges";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public GraphTables {
    validate(entities);
    validate(finalEntities);
    validate(referenceEdges);
  }

  public static GraphTables defaults() {
    return new GraphTables(DEFAULT_ENTITIES, DEFAULT_FINAL_ENTITIES, DEFAULT_REFERENCE_EDGES);
  }

  public boolean isDefault() {
    return equals(defaults());
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
