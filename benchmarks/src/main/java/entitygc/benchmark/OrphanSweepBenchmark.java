package entitygc.benchmark;

import entitygc.OrphanCollector;
import entitygc.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import entitygc.jdbc.DataSourceConnectionProvider;
import entitygc.jdbc.tx.JdbcTransactionManager;
import entitygc.jdbc.tx.ThreadLocalTxContext;
import entitygc.model.EdgeRetention;
import entitygc.model.ReprocessingSignal;
import org.openjdk.jmh.annotations.*;

import javax.sql.DataSource;
import java.util.concurrent.TimeUnit;

/**
 * Measures one full sweep (snapshot load, mark, delete, flag, prune) in its own transaction.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar OrphanSweepBenchmark}
 * <p>PostgreSQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=postgresql OrphanSweepBenchmark}
 */
@BenchmarkMode(Mode.SingleShotTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3)
@Measurement(iterations = 10)
@Fork(1)
public class OrphanSweepBenchmark {

  @Param({"h2"})
  private String database;

  @Param({"10000", "50000"})
  private int entities;

  @Param({"0.05"})
  private double orphanRatio;

  @Param({"FLAG", "SENTINEL_HASH"})
  private ReprocessingSignal signal;

  private DataSource dataSource;
  private BenchmarkGraph graph;
  private JdbcTransactionManager txManager;
  private OrphanCollector collector;

  @Setup(Level.Trial)
  public void setup() {
    DatabaseSetup db = BenchmarkDataSourceFactory.create(database);
    dataSource = db.dataSource();
    graph = BenchmarkGraph.generate(entities, orphanRatio);
    ThreadLocalTxContext txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), txContext);
    collector = OrphanCollector.builder()
        .graphStore(db.store())
        .txContext(txContext)
        .reprocessingSignal(signal)
        .edgeRetention(EdgeRetention.PRUNE)
        .build();
  }

  @Setup(Level.Invocation)
  public void reload() {
    BenchmarkDataSourceFactory.load(dataSource, graph);
  }

  @Benchmark
  public int sweep() throws Exception {
    int deleted = txManager.inTransaction(collector::collect);
    if (deleted != graph.orphanCount()) {
      throw new IllegalStateException("Expected " + graph.orphanCount() + " deletions, got " + deleted);
    }
    return deleted;
  }
}
