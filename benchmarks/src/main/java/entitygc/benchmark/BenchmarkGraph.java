package entitygc.benchmark;

import entitygc.model.GraphSnapshot;
import entitygc.model.ReferenceEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic entity graph: a live binary tree hanging off one root edge and a
 * detached orphan tree whose leaves also reference live entities.
 */
record BenchmarkGraph(List<String> entityRefs, List<ReferenceEdge> edges, int orphanCount) {

  static BenchmarkGraph generate(int entityCount, double orphanRatio) {
    if (entityCount < 2) {
      throw new IllegalArgumentException("entityCount must be >= 2");
    }
    int orphans = Math.max(1, (int) (entityCount * orphanRatio));
    int live = entityCount - orphans;

    List<String> refs = new ArrayList<>(entityCount);
    List<ReferenceEdge> edges = new ArrayList<>(entityCount + orphans / 2 + 1);
    for (int i = 0; i < live; i++) {
      refs.add(liveRef(i));
    }
    for (int i = 0; i < orphans; i++) {
      refs.add(orphanRef(i));
    }

    if (live > 0) {
      edges.add(ReferenceEdge.root("bench-provider", liveRef(0)));
    }
    for (int i = 1; i < live; i++) {
      edges.add(ReferenceEdge.internal(liveRef((i - 1) / 2), liveRef(i)));
    }
    for (int i = 1; i < orphans; i++) {
      edges.add(ReferenceEdge.internal(orphanRef((i - 1) / 2), orphanRef(i)));
    }
    for (int i = orphans / 2; live > 0 && i < orphans; i++) {
      edges.add(ReferenceEdge.internal(orphanRef(i), liveRef(i % live)));
    }
    return new BenchmarkGraph(refs, edges, orphans);
  }

  GraphSnapshot snapshot() {
    return GraphSnapshot.of(entityRefs, edges);
  }

  private static String liveRef(int i) {
    return "component:default/live-" + i;
  }

  private static String orphanRef(int i) {
    return "component:default/orphan-" + i;
  }
}
