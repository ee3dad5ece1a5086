package entitygc.reach;

import entitygc.model.GraphSnapshot;

import java.util.Set;

/**
 * Computes which entity references are reachable from any root.
 *
 * <p>Implementations must terminate on cyclic graphs and must not mutate storage.
 * The result may contain references that have no entity row (dangling root or
 * edge targets); callers intersect with {@link GraphSnapshot#entityRefs()} as needed.
 *
 * @see BreadthFirstReachability
 */
@FunctionalInterface
public interface ReachabilityEngine {

  /**
   * Returns every reference reachable by following edges forward from the
   * target of each root edge.
   */
  Set<String> reachable(GraphSnapshot snapshot);
}
