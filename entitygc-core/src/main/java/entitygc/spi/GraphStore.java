package entitygc.spi;

import entitygc.model.GraphSnapshot;
import entitygc.model.ReprocessingSignal;

import java.sql.Connection;
import java.util.Collection;

/**
 * Storage access used by {@link entitygc.OrphanCollector}.
 *
 * <p>Every method runs on the connection it is given and never commits, rolls
 * back or changes auto-commit. Storage failures surface as unchecked exceptions.
 */
public interface GraphStore {

  /**
   * Reads every entity reference and every reference edge.
   *
   * @throws entitygc.GraphIntegrityException if the rows violate the graph invariants
   */
  GraphSnapshot loadSnapshot(Connection conn);

  /**
   * Deletes the entity rows and their final entity rows.
   *
   * @param entityRefs references to delete
   * @return number of entity rows deleted
   */
  int deleteEntities(Connection conn, Collection<String> entityRefs);

  /**
   * Flags surviving entities for reprocessing.
   *
   * @param entityRefs references to flag
   * @param signal     how the flag is persisted
   * @return number of entity rows whose state changed
   */
  int markForReprocessing(Connection conn, Collection<String> entityRefs, ReprocessingSignal signal);

  /**
   * Deletes internal edges whose source is one of {@code sourceEntityRefs}.
   *
   * @return number of edge rows deleted
   */
  int pruneEdgesFrom(Connection conn, Collection<String> sourceEntityRefs);
}
