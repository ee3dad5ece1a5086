package entitygc.model;

/**
 * What happens to internal reference edges whose source entity was deleted.
 */
public enum EdgeRetention {

  /** Delete the edges in the same transaction as their source entity. */
  PRUNE,

  /**
   * Leave the edges in place. They point from a reference with no entity row
   * and are ignored by later sweeps.
   */
  RETAIN
}
