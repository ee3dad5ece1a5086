package entitygc.jdbc;

import entitygc.jdbc.store.AbstractJdbcGraphStore;
import entitygc.jdbc.store.MySqlGraphStore;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlGraphStoreIntegrationTest extends AbstractGraphStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("entitygc_test");

  private static SimpleDataSource dataSource;
  private final MySqlGraphStore store = new MySqlGraphStore();

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    GraphFixture.applySchema(dataSource, "/schema/mysql.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcGraphStore store() {
    return store;
  }
}
