package entitygc;

import entitygc.model.EdgeRetention;
import entitygc.model.GraphSnapshot;
import entitygc.model.ReprocessingSignal;
import entitygc.model.SweepResult;
import entitygc.reach.BreadthFirstReachability;
import entitygc.reach.ReachabilityEngine;
import entitygc.reach.SweepPlan;
import entitygc.spi.GraphStore;
import entitygc.spi.MetricsExporter;
import entitygc.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes entities that are no longer reachable from any root and flags their
 * surviving children for reprocessing.
 *
 * <p>A sweep runs entirely inside the caller's transaction: it reads the
 * snapshot, computes reachability, deletes orphans (entity and final entity
 * rows), flags every surviving direct child of a deleted entity, and
 * optionally prunes the deleted entities' outgoing edges. By default a child
 * is flagged through its {@code needs_reprocessing} column and its hashes are
 * not changed; the sentinel hash is written only when the collector is built
 * with {@code reprocessingSignal(ReprocessingSignal.SENTINEL_HASH)}. It never opens,
 * commits or rolls back a transaction. Any exception propagates unchanged and
 * the caller must roll back.
 *
 * <pre>{@code
 * OrphanCollector collector = OrphanCollector.builder()
 *     .graphStore(JdbcGraphStores.detect(dataSource))
 *     .txContext(txContext)
 *     .build();
 *
 * try (var tx = txManager.begin()) {
 *   int deleted = collector.collect();
 *   tx.commit();
 * }
 * }</pre>
 *
 * @see OrphanCollector.Builder
 * @see GraphStore
 */
public final class OrphanCollector {
  private static final Logger logger = Logger.getLogger(OrphanCollector.class.getName());

  private final GraphStore graphStore;
  private final TxContext txContext;
  private final ReachabilityEngine reachability;
  private final ReprocessingSignal reprocessingSignal;
  private final EdgeRetention edgeRetention;
  private final MetricsExporter metrics;

  private OrphanCollector(Builder builder) {
    this.graphStore = Objects.requireNonNull(builder.graphStore, "graphStore");
    this.txContext = builder.txContext;
    this.reachability = builder.reachability != null
        ? builder.reachability : new BreadthFirstReachability();
    this.reprocessingSignal = builder.reprocessingSignal != null
        ? builder.reprocessingSignal : ReprocessingSignal.FLAG;
    this.edgeRetention = builder.edgeRetention != null
        ? builder.edgeRetention : EdgeRetention.PRUNE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sweeps using the connection of the transaction bound to the configured {@link TxContext}.
   *
   * @return number of entities deleted; provisional until commit
   * @throws IllegalStateException if no {@link TxContext} is configured or no transaction is active
   */
  public int collect() {
    if (txContext == null) {
      throw new IllegalStateException("No TxContext configured; use collect(Connection)");
    }
    if (!txContext.isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return collect(txContext.currentConnection());
  }

  /**
   * Sweeps using an explicit transactional connection.
   *
   * @param conn connection of an open transaction (auto-commit disabled)
   * @return number of entities deleted; provisional until commit
   */
  public int collect(Connection conn) {
    return sweep(conn).deletedCount();
  }

  /**
   * Sweeps using an explicit transactional connection and returns the full outcome.
   *
   * @param conn connection of an open transaction (auto-commit disabled)
   * @return what was deleted, flagged and pruned
   * @throws IllegalStateException   if {@code conn} is in auto-commit mode
   * @throws GraphIntegrityException if the graph violates its invariants
   */
  public SweepResult sweep(Connection conn) {
    Objects.requireNonNull(conn, "conn");
    requireTransactional(conn);

    long start = System.nanoTime();
    SweepResult result;
    try {
      result = doSweep(conn);
    } catch (RuntimeException e) {
      metrics.incrementSweepFailures();
      throw e;
    }
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    if (!result.isEmpty()) {
      logger.log(Level.INFO,
          "Sweep deleted {0} orphaned entities, flagged {1} for reprocessing, pruned {2} edges",
          new Object[]{result.deletedCount(), result.markedCount(), result.prunedEdges()});
    }
    report(result, durationMs);
    return result;
  }

  private SweepResult doSweep(Connection conn) {
    GraphSnapshot snapshot = graphStore.loadSnapshot(conn);
    logger.log(Level.FINE, "Loaded {0}", snapshot);

    Set<String> reachable = reachability.reachable(snapshot);
    SweepPlan plan = SweepPlan.of(snapshot, reachable);
    if (plan.isEmpty()) {
      return new SweepResult(Set.of(), Set.of(), 0,
          snapshot.entityRefs().size(), snapshot.edgeCount());
    }
    if (!plan.danglingTargets().isEmpty()) {
      logger.log(Level.WARNING, "Orphaned entities reference targets with no entity row: {0}",
          plan.danglingTargets());
    }

    int deleted = graphStore.deleteEntities(conn, plan.orphans());
    if (deleted != plan.orphans().size()) {
      throw new GraphIntegrityException("Expected to delete " + plan.orphans().size() +
          " orphaned entities but deleted " + deleted);
    }

    if (!plan.childrenToMark().isEmpty()) {
      int changed = graphStore.markForReprocessing(conn, plan.childrenToMark(), reprocessingSignal);
      logger.log(Level.FINE, "Flagged {0} of {1} children of deleted entities ({2})",
          new Object[]{changed, plan.childrenToMark().size(), reprocessingSignal});
    }

    int pruned = 0;
    if (edgeRetention == EdgeRetention.PRUNE && plan.orphanEdges() > 0) {
      pruned = graphStore.pruneEdgesFrom(conn, plan.orphans());
    }

    return new SweepResult(plan.orphans(), plan.childrenToMark(), pruned,
        snapshot.entityRefs().size(), snapshot.edgeCount());
  }

  private void report(SweepResult result, long durationMs) {
    Runnable publish = () -> {
      metrics.incrementSweeps();
      metrics.incrementEntitiesDeleted(result.deletedCount());
      metrics.incrementEntitiesMarked(result.markedCount());
      metrics.incrementEdgesPruned(result.prunedEdges());
      metrics.recordSnapshotSize(result.snapshotEntities(), result.snapshotEdges());
      metrics.recordSweepDurationMs(durationMs);
    };
    if (txContext != null && txContext.isTransactionActive()) {
      txContext.afterCommit(publish);
    } else {
      publish.run();
    }
  }

  private static void requireTransactional(Connection conn) {
    boolean autoCommit;
    try {
      autoCommit = conn.getAutoCommit();
    } catch (SQLException e) {
      throw new IllegalStateException("Unable to read auto-commit state", e);
    }
    if (autoCommit) {
      throw new IllegalStateException(
          "Orphan collection must run inside a transaction; connection is in auto-commit mode");
    }
  }

  /** Builder for {@link OrphanCollector}. */
  public static final class Builder {
    private GraphStore graphStore;
    private TxContext txContext;
    private ReachabilityEngine reachability;
    private ReprocessingSignal reprocessingSignal;
    private EdgeRetention edgeRetention;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the storage backend for snapshots, deletes and flags.
     *
     * <p><b>Required.</b>
     *
     * @param graphStore the graph store
     * @return this builder
     */
    public Builder graphStore(GraphStore graphStore) {
      this.graphStore = graphStore;
      return this;
    }

    /**
     * Sets the transaction context used by {@link OrphanCollector#collect()} and
     * for deferring metrics until commit.
     *
     * <p>Optional. Without it only {@link OrphanCollector#collect(Connection)} is usable.
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Sets the reachability engine.
     *
     * <p>Optional. Defaults to {@link BreadthFirstReachability}.
     *
     * @param reachability the engine
     * @return this builder
     */
    public Builder reachability(ReachabilityEngine reachability) {
      this.reachability = reachability;
      return this;
    }

    /**
     * Sets how surviving children of deleted entities are flagged.
     *
     * <p>Optional. Defaults to {@link ReprocessingSignal#FLAG}, which sets
     * {@code needs_reprocessing} and leaves {@code result_hash} and the final
     * entity hash untouched. Pass {@link ReprocessingSignal#SENTINEL_HASH} to
     * write {@value ReprocessingSignal#SENTINEL_HASH_VALUE} into both hashes instead.
     *
     * @param reprocessingSignal the signal
     * @return this builder
     */
    public Builder reprocessingSignal(ReprocessingSignal reprocessingSignal) {
      this.reprocessingSignal = reprocessingSignal;
      return this;
    }

    /**
     * Sets what happens to edges whose source entity was deleted.
     *
     * <p>Optional. Defaults to {@link EdgeRetention#PRUNE}.
     *
     * @param edgeRetention the retention policy
     * @return this builder
     */
    public Builder edgeRetention(EdgeRetention edgeRetention) {
      this.edgeRetention = edgeRetention;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the collector.
     *
     * @return a new {@link OrphanCollector}
     * @throws NullPointerException if {@code graphStore} is null
     */
    public OrphanCollector build() {
      return new OrphanCollector(this);
    }
  }
}
