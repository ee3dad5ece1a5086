package entitygc.reach;

import entitygc.model.GraphSnapshot;
import entitygc.model.ReferenceEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory breadth-first traversal over a {@link GraphSnapshot}.
 *
 * <p>Builds a forward adjacency index from the internal edges, seeds the queue
 * with every root target and visits each reference at most once. Memory is
 * linear in the snapshot's node and edge count.
 */
public final class BreadthFirstReachability implements ReachabilityEngine {

  @Override
  public Set<String> reachable(GraphSnapshot snapshot) {
    Map<String, List<String>> children = adjacency(snapshot);

    Set<String> visited = new HashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String root : snapshot.rootTargets()) {
      if (visited.add(root)) {
        queue.add(root);
      }
    }

    while (!queue.isEmpty()) {
      String current = queue.poll();
      for (String child : children.getOrDefault(current, List.of())) {
        if (visited.add(child)) {
          queue.add(child);
        }
      }
    }
    return visited;
  }

  private static Map<String, List<String>> adjacency(GraphSnapshot snapshot) {
    Map<String, List<String>> children = new HashMap<>();
    for (ReferenceEdge edge : snapshot.internalEdges()) {
      children.computeIfAbsent(edge.sourceEntityRef(), k -> new ArrayList<>())
          .add(edge.targetEntityRef());
    }
    return children;
  }
}
