/**
 * Transactional garbage collection of orphaned entities.
 *
 * <p>{@link entitygc.OrphanCollector} is the entry point. It computes, from one
 * snapshot of the reference graph, which entities can no longer be reached from
 * any root, deletes them, and flags their surviving children for reprocessing.
 * Deciding when to run a sweep is left to the caller.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code entitygc.model}: snapshot and result value types</li>
 *   <li>{@code entitygc.reach}: reachability and sweep planning</li>
 *   <li>{@code entitygc.spi}: storage, transaction and metrics extension points</li>
 * </ul>
 *
 * @see entitygc.OrphanCollector
 */
package entitygc;
