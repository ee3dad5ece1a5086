package entitygc.reach;

import entitygc.model.GraphSnapshot;
import entitygc.model.ReferenceEdge;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The pure part of a sweep: which entities to delete, which survivors to flag,
 * and which internal edges originate from a deleted entity.
 *
 * <p>An entity is an orphan when it has a row in the snapshot but is not
 * reachable. A survivor is flagged when at least one of its direct parents is
 * an orphan, even if other parents keep it reachable. Edge targets without an
 * entity row are never flagged.
 */
public final class SweepPlan {
  private final Set<String> orphans;
  private final Set<String> childrenToMark;
  private final Set<String> danglingTargets;
  private final int orphanEdges;

  private SweepPlan(Set<String> orphans, Set<String> childrenToMark,
      Set<String> danglingTargets, int orphanEdges) {
    this.orphans = orphans;
    this.childrenToMark = childrenToMark;
    this.danglingTargets = danglingTargets;
    this.orphanEdges = orphanEdges;
  }

  public static SweepPlan of(GraphSnapshot snapshot, Set<String> reachable) {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(reachable, "reachable");

    Set<String> orphans = new LinkedHashSet<>();
    for (String ref : snapshot.entityRefs()) {
      if (!reachable.contains(ref)) {
        orphans.add(ref);
      }
    }

    Set<String> childrenToMark = new LinkedHashSet<>();
    Set<String> dangling = new LinkedHashSet<>();
    int orphanEdges = 0;
    for (ReferenceEdge edge : snapshot.internalEdges()) {
      if (!orphans.contains(edge.sourceEntityRef())) {
        continue;
      }
      orphanEdges++;
      String target = edge.targetEntityRef();
      if (orphans.contains(target)) {
        continue;
      }
      if (snapshot.contains(target)) {
        childrenToMark.add(target);
      } else {
        dangling.add(target);
      }
    }

    return new SweepPlan(
        Collections.unmodifiableSet(orphans),
        Collections.unmodifiableSet(childrenToMark),
        Collections.unmodifiableSet(dangling),
        orphanEdges);
  }

  /** Entity references to delete, in snapshot order. */
  public Set<String> orphans() {
    return orphans;
  }

  /** Surviving entity references with at least one orphaned direct parent. */
  public Set<String> childrenToMark() {
    return childrenToMark;
  }

  /** Targets of orphan edges that have no entity row; tolerated and skipped. */
  public Set<String> danglingTargets() {
    return danglingTargets;
  }

  /** Number of internal edges whose source is an orphan. */
  public int orphanEdges() {
    return orphanEdges;
  }

  public boolean isEmpty() {
    return orphans.isEmpty();
  }
}
