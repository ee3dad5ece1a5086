package entitygc.benchmark;

import entitygc.model.GraphSnapshot;
import entitygc.reach.BreadthFirstReachability;
import entitygc.reach.SweepPlan;
import org.openjdk.jmh.annotations.*;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Measures the in-memory mark phase: reachability plus sweep planning.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar ReachabilityBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class ReachabilityBenchmark {

  @Param({"10000", "100000", "1000000"})
  private int entities;

  @Param({"0.01", "0.2"})
  private double orphanRatio;

  private GraphSnapshot snapshot;
  private final BreadthFirstReachability reachability = new BreadthFirstReachability();

  @Setup(Level.Trial)
  public void setup() {
    snapshot = BenchmarkGraph.generate(entities, orphanRatio).snapshot();
  }

  @Benchmark
  public Set<String> reachable() {
    return reachability.reachable(snapshot);
  }

  @Benchmark
  public SweepPlan plan() {
    return SweepPlan.of(snapshot, reachability.reachable(snapshot));
  }
}
