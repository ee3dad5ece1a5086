package entitygc.model;

import entitygc.GraphIntegrityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of the entity references and reference edges visible inside
 * one transaction.
 *
 * <p>Rejects malformed input eagerly: a duplicate entity reference or an edge
 * that is not {@linkplain ReferenceEdge#isWellFormed() well formed} means an
 * upstream invariant is broken, and sweeping on top of it could delete live data.
 */
public final class GraphSnapshot {
  private final Set<String> entityRefs;
  private final List<ReferenceEdge> rootEdges;
  private final List<ReferenceEdge> internalEdges;

  private GraphSnapshot(Set<String> entityRefs, List<ReferenceEdge> rootEdges,
      List<ReferenceEdge> internalEdges) {
    this.entityRefs = entityRefs;
    this.rootEdges = rootEdges;
    this.internalEdges = internalEdges;
  }

  /**
   * Builds a snapshot from raw store rows.
   *
   * @param entityRefs every {@code entity_ref} in the entity table, one per row
   * @param edges      every row of the reference edge table
   * @throws GraphIntegrityException if a reference repeats or an edge is malformed
   */
  public static GraphSnapshot of(Collection<String> entityRefs, Collection<ReferenceEdge> edges) {
    Objects.requireNonNull(entityRefs, "entityRefs");
    Objects.requireNonNull(edges, "edges");

    Set<String> refs = new LinkedHashSet<>(entityRefs.size() * 2);
    for (String ref : entityRefs) {
      if (ref == null) {
        throw new GraphIntegrityException("Entity row without entity_ref");
      }
      if (!refs.add(ref)) {
        throw new GraphIntegrityException("Duplicate entity_ref in snapshot: " + ref);
      }
    }

    List<ReferenceEdge> roots = new ArrayList<>();
    List<ReferenceEdge> internal = new ArrayList<>();
    for (ReferenceEdge edge : edges) {
      if (edge == null || !edge.isWellFormed()) {
        throw new GraphIntegrityException("Malformed reference edge: " + edge);
      }
      if (edge.isRoot()) {
        roots.add(edge);
      } else {
        internal.add(edge);
      }
    }
    return new GraphSnapshot(Collections.unmodifiableSet(refs),
        Collections.unmodifiableList(roots), Collections.unmodifiableList(internal));
  }

  public Set<String> entityRefs() {
    return entityRefs;
  }

  public boolean contains(String entityRef) {
    return entityRefs.contains(entityRef);
  }

  public List<ReferenceEdge> rootEdges() {
    return rootEdges;
  }

  public List<ReferenceEdge> internalEdges() {
    return internalEdges;
  }

  /** Targets of every root edge, in edge order, without duplicates. */
  public Set<String> rootTargets() {
    Set<String> targets = new LinkedHashSet<>();
    for (ReferenceEdge edge : rootEdges) {
      targets.add(edge.targetEntityRef());
    }
    return targets;
  }

  public int edgeCount() {
    return rootEdges.size() + internalEdges.size();
  }

  @Override
  public String toString() {
    return "GraphSnapshot[entities=" + entityRefs.size() +
        ", rootEdges=" + rootEdges.size() +
        ", internalEdges=" + internalEdges.size() + "]";
  }
}
