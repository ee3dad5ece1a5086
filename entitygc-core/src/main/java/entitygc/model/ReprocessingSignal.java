package entitygc.model;

/**
 * How a surviving child of a deleted entity is told that its derived output is stale.
 *
 * <p>Both signals follow the same rule: one deleted direct parent is enough,
 * regardless of how many live parents the child still has.
 */
public enum ReprocessingSignal {

  /**
   * Sets {@code needs_reprocessing} on the entity row. Content fingerprints are
   * left untouched.
   */
  FLAG,

  /**
   * Overwrites {@code result_hash} on the entity row and {@code hash} on the
   * final entity row with {@link #SENTINEL_HASH_VALUE}, for schemas that have
   * no {@code needs_reprocessing} column.
   */
  SENTINEL_HASH;

  /** Fingerprint value written by {@link #SENTINEL_HASH}. */
  public static final String SENTINEL_HASH_VALUE = "orphan-parent-deleted";
}
