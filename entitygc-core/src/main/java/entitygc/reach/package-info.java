/**
 * Reachability over a graph snapshot and the sweep plan derived from it.
 *
 * <p>Nothing in this package touches storage. {@link entitygc.reach.ReachabilityEngine}
 * is the seam for alternative traversals (for example a recursive SQL query);
 * {@link entitygc.reach.BreadthFirstReachability} is the default.
 *
 * @see entitygc.reach.SweepPlan
 */
package entitygc.reach;
