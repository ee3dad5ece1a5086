package entitygc.model;

import java.util.Set;

/**
 * Outcome of one sweep. All figures are provisional until the enclosing
 * transaction commits.
 *
 * @param deletedRefs      references of the entities that were deleted
 * @param markedRefs       surviving references flagged for reprocessing
 * @param prunedEdges      internal edges removed along with their source
 * @param snapshotEntities entity rows seen in the snapshot
 * @param snapshotEdges    edge rows seen in the snapshot
 */
public record SweepResult(
    Set<String> deletedRefs,
    Set<String> markedRefs,
    int prunedEdges,
    int snapshotEntities,
    int snapshotEdges
) {

  public SweepResult {
    deletedRefs = Set.copyOf(deletedRefs);
    markedRefs = Set.copyOf(markedRefs);
  }

  public int deletedCount() {
    return deletedRefs.size();
  }

  public int markedCount() {
    return markedRefs.size();
  }

  public boolean isEmpty() {
    return deletedRefs.isEmpty() && markedRefs.isEmpty() && prunedEdges == 0;
  }
}
