package entitygc.spi;

/**
 * Observability hook for exporting sweep counters and gauges to a metrics backend.
 *
 * <p>Counts are reported by {@link entitygc.OrphanCollector} once the enclosing
 * transaction has committed, when it can observe the commit.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the number of completed sweeps.
   */
  void incrementSweeps();

  /**
   * Increments the number of sweeps that failed with an exception.
   */
  void incrementSweepFailures();

  /**
   * Adds to the number of entities deleted as orphans.
   */
  void incrementEntitiesDeleted(int count);

  /**
   * Adds to the number of surviving entities flagged for reprocessing.
   */
  void incrementEntitiesMarked(int count);

  /**
   * Adds to the number of reference edges pruned with their source.
   */
  default void incrementEdgesPruned(int count) {
  }

  /**
   * Records the size of the last snapshot.
   */
  void recordSnapshotSize(int entities, int edges);

  /**
   * Records how long the last sweep took, from snapshot load to final write.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordSweepDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementSweeps() {
    }

    @Override
    public void incrementSweepFailures() {
    }

    @Override
    public void incrementEntitiesDeleted(int count) {
    }

    @Override
    public void incrementEntitiesMarked(int count) {
    }

    @Override
    public void recordSnapshotSize(int entities, int edges) {
    }
  }
}
