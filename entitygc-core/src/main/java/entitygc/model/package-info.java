/**
 * Value types describing one snapshot of the entity graph and the outcome of sweeping it.
 *
 * @see entitygc.model.GraphSnapshot
 * @see entitygc.model.ReferenceEdge
 * @see entitygc.model.SweepResult
 */
package entitygc.model;
