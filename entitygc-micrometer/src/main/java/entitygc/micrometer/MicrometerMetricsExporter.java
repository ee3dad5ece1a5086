package entitygc.micrometer;

import entitygc.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code entitygc.sweep.runs}: committed sweeps</li>
 *   <li>{@code entitygc.sweep.failures}: sweeps that threw</li>
 *   <li>{@code entitygc.entities.deleted}: orphaned entities deleted</li>
 *   <li>{@code entitygc.entities.marked}: survivors marked for reprocessing</li>
 *   <li>{@code entitygc.edges.pruned}: reference edges removed with their source</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code entitygc.snapshot.entities}: entities seen by the last sweep</li>
 *   <li>{@code entitygc.snapshot.edges}: reference edges seen by the last sweep</li>
 *   <li>{@code entitygc.sweep.duration.ms}: duration of the last sweep</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter sweeps;
  private final Counter sweepFailures;
  private final Counter entitiesDeleted;
  private final Counter entitiesMarked;
  private final Counter edgesPruned;
  private final Gauge snapshotEntitiesGauge;
  private final Gauge snapshotEdgesGauge;
  private final Gauge durationGauge;

  private final AtomicInteger snapshotEntities = new AtomicInteger();
  private final AtomicInteger snapshotEdges = new AtomicInteger();
  private final AtomicLong lastDurationMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "entitygc"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "entitygc");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several
   * collectors against different catalogs in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "catalog.gc"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.sweeps = Counter.builder(namePrefix + ".sweep.runs")
        .description("Orphan sweeps committed")
        .register(registry);
    this.sweepFailures = Counter.builder(namePrefix + ".sweep.failures")
        .description("Orphan sweeps that failed")
        .register(registry);
    this.entitiesDeleted = Counter.builder(namePrefix + ".entities.deleted")
        .description("Orphaned entities deleted")
        .register(registry);
    this.entitiesMarked = Counter.builder(namePrefix + ".entities.marked")
        .description("Surviving entities marked for reprocessing")
        .register(registry);
    this.edgesPruned = Counter.builder(namePrefix + ".edges.pruned")
        .description("Reference edges pruned with their deleted source")
        .register(registry);

    this.snapshotEntitiesGauge = Gauge.builder(namePrefix + ".snapshot.entities", snapshotEntities, AtomicInteger::get)
        .register(registry);
    this.snapshotEdgesGauge = Gauge.builder(namePrefix + ".snapshot.edges", snapshotEdges, AtomicInteger::get)
        .register(registry);
    this.durationGauge = Gauge.builder(namePrefix + ".sweep.duration.ms", lastDurationMs, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementSweeps() {
    if (closed) return;
    sweeps.increment();
  }

  @Override
  public void incrementSweepFailures() {
    if (closed) return;
    sweepFailures.increment();
  }

  @Override
  public void incrementEntitiesDeleted(int count) {
    if (closed) return;
    entitiesDeleted.increment(count);
  }

  @Override
  public void incrementEntitiesMarked(int count) {
    if (closed) return;
    entitiesMarked.increment(count);
  }

  @Override
  public void incrementEdgesPruned(int count) {
    if (closed) return;
    edgesPruned.increment(count);
  }

  @Override
  public void recordSnapshotSize(int entities, int edges) {
    if (closed) return;
    snapshotEntities.set(entities);
    snapshotEdges.set(edges);
  }

  @Override
  public void recordSweepDurationMs(long durationMs) {
    if (closed) return;
    lastDurationMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(sweeps, sweepFailures, entitiesDeleted, entitiesMarked, edgesPruned,
        snapshotEntitiesGauge, snapshotEdgesGauge, durationGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
