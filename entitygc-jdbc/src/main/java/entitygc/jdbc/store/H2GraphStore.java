package entitygc.jdbc.store;

import entitygc.jdbc.GraphTables;

import java.util.List;

/**
 * H2 graph store. Uses the portable SQL from {@link AbstractJdbcGraphStore}.
 */
public final class H2GraphStore extends AbstractJdbcGraphStore {

  public H2GraphStore() {
    super();
  }

  public H2GraphStore(GraphTables tables, int batchSize) {
    super(tables, batchSize);
  }

  @Override
  public AbstractJdbcGraphStore withConfig(GraphTables tables, int batchSize) {
    return new H2GraphStore(tables, batchSize);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
