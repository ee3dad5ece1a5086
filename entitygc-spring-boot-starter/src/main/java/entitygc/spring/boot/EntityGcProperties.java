package entitygc.spring.boot;

import entitygc.jdbc.store.AbstractJdbcGraphStore;
import entitygc.model.EdgeRetention;
import entitygc.model.ReprocessingSignal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the orphan collector.
 *
 * @see EntityGcAutoConfiguration
 */
@ConfigurationProperties(prefix = "entitygc")
public class EntityGcProperties {

  /**
   * Table holding one row per catalog entity.
   */
  private String entitiesTable = "entities";

  /**
   * Table holding the stitched final row of each entity.
   */
  private String finalEntitiesTable = "final_entities";

  /**
   * Table holding root and internal reference edges.
   */
  private String referenceEdgesTable = "reference_edges";

  /**
   * Maximum number of entity references bound in one statement.
   */
  private int batchSize = AbstractJdbcGraphStore.DEFAULT_BATCH_SIZE;

  /**
   * Whether outgoing edges of deleted entities are removed or left dangling.
   */
  private EdgeRetention edgeRetention = EdgeRetention.PRUNE;

  /**
   * How surviving children of deleted entities are marked for reprocessing.
   * {@code FLAG} sets {@code needs_reprocessing}; {@code SENTINEL_HASH} overwrites
   * {@code result_hash} and the final entity hash with the sentinel value.
   */
  private ReprocessingSignal reprocessingSignal = ReprocessingSignal.FLAG;

  private final Metrics metrics = new Metrics();

  public String getEntitiesTable() {
    return entitiesTable;
  }

  public void setEntitiesTable(String entitiesTable) {
    this.entitiesTable = entitiesTable;
  }

  public String getFinalEntitiesTable() {
    return finalEntitiesTable;
  }

  public void setFinalEntitiesTable(String finalEntitiesTable) {
    this.finalEntitiesTable = finalEntitiesTable;
  }

  public String getReferenceEdgesTable() {
    return referenceEdgesTable;
  }

  public void setReferenceEdgesTable(String referenceEdgesTable) {
    this.referenceEdgesTable = referenceEdgesTable;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public EdgeRetention getEdgeRetention() {
    return edgeRetention;
  }

  public void setEdgeRetention(EdgeRetention edgeRetention) {
    this.edgeRetention = edgeRetention;
  }

  public ReprocessingSignal getReprocessingSignal() {
    return reprocessingSignal;
  }

  public void setReprocessingSignal(ReprocessingSignal reprocessingSignal) {
    this.reprocessingSignal = reprocessingSignal;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "entitygc";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
