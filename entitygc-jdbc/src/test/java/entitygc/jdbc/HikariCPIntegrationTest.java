package entitygc.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import entitygc.OrphanCollector;
import entitygc.jdbc.store.JdbcGraphStores;
import entitygc.jdbc.tx.JdbcTransactionManager;
import entitygc.jdbc.tx.ThreadLocalTxContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private GraphFixture fixture;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(2);
    config.setMinimumIdle(1);
    config.setPoolName("entitygc-test-pool");

    hikariDs = new HikariDataSource(config);
    fixture = GraphFixture.createH2(hikariDs, GraphTables.defaults());
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(new DataSourceConnectionProvider(hikariDs), txContext);
  }

  @AfterEach
  void teardown() {
    if (hikariDs != null) {
      hikariDs.close();
    }
  }

  @Test
  void repeatedSweepsReturnConnectionsToPool() throws Exception {
    OrphanCollector collector = OrphanCollector.builder()
        .graphStore(JdbcGraphStores.detect(hikariDs))
        .txContext(txContext)
        .build();

    for (int round = 0; round < 10; round++) {
      fixture.entities("root-" + round, "orphan-" + round);
      fixture.root("provider", "root-" + round);
      fixture.edge("orphan-" + round, "root-" + round);

      int deleted = txManager.inTransaction(collector::collect);
      assertEquals(1, deleted);
    }

    assertEquals(10, fixture.flagged().size());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
    try (Connection conn = hikariDs.getConnection()) {
      assertTrue(conn.getAutoCommit());
    }
  }

  @Test
  void failedSweepReleasesConnection() throws Exception {
    fixture.entities("A");
    OrphanCollector broken = OrphanCollector.builder()
        .graphStore(JdbcGraphStores.detect(hikariDs, new GraphTables("missing", "final_entities", "reference_edges"), 10))
        .txContext(txContext)
        .build();

    for (int i = 0; i < 5; i++) {
      assertThrows(GraphStoreException.class, () -> txManager.inTransaction(broken::collect));
    }

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
    assertEquals(Set.of("A"), fixture.entityRefs());
  }
}
