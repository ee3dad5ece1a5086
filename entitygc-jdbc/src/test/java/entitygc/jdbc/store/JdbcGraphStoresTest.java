package entitygc.jdbc.store;

import entitygc.jdbc.GraphTables;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcGraphStoresTest {

  @Test
  void allRegisteredStoresAreLoaded() {
    assertEquals(3, JdbcGraphStores.all().size());
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertInstanceOf(H2GraphStore.class, JdbcGraphStores.get("H2"));
    assertInstanceOf(MySqlGraphStore.class, JdbcGraphStores.get("mysql"));
    assertInstanceOf(PostgresGraphStore.class, JdbcGraphStores.get("PostgreSQL"));
  }

  @Test
  void getUnknownThrows() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcGraphStores.get("oracle"));
    assertTrue(e.getMessage().contains("oracle"));
  }

  @Test
  void detectFromUrl() {
    assertInstanceOf(MySqlGraphStore.class, JdbcGraphStores.detect("jdbc:mysql://localhost/catalog"));
    assertInstanceOf(MySqlGraphStore.class, JdbcGraphStores.detect("jdbc:mariadb://localhost/catalog"));
    assertInstanceOf(PostgresGraphStore.class, JdbcGraphStores.detect("jdbc:postgresql://localhost/catalog"));
    assertInstanceOf(H2GraphStore.class, JdbcGraphStores.detect("jdbc:h2:mem:test"));
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcGraphStores.detect("jdbc:oracle:thin:@x"));
    assertThrows(IllegalArgumentException.class, () -> JdbcGraphStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcGraphStores.detect((String) null));
  }

  @Test
  void detectFromDataSourceWithCustomTables() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID());
    GraphTables tables = new GraphTables("e", "f", "r");

    AbstractJdbcGraphStore store = JdbcGraphStores.detect(ds, tables, 50);

    assertInstanceOf(H2GraphStore.class, store);
    assertEquals(tables, store.tables());
    assertEquals(50, store.batchSize());
  }
}
