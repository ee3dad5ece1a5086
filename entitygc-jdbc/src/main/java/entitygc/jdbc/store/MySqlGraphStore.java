package entitygc.jdbc.store;

import entitygc.jdbc.GraphTables;
import entitygc.jdbc.JdbcTemplate;
import entitygc.model.ReprocessingSignal;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL graph store. Also compatible with MariaDB.
 *
 * <p>Final entity rows are deleted and updated through multi-table
 * {@code DELETE ... JOIN} / {@code UPDATE ... JOIN} statements instead of
 * {@code IN (SELECT ...)} subqueries, which MySQL executes as dependent
 * subqueries on older versions.
 */
public final class MySqlGraphStore extends AbstractJdbcGraphStore {

  public MySqlGraphStore() {
    super();
  }

  public MySqlGraphStore(GraphTables tables, int batchSize) {
    super(tables, batchSize);
  }

  @Override
  public AbstractJdbcGraphStore withConfig(GraphTables tables, int batchSize) {
    return new MySqlGraphStore(tables, batchSize);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  protected int deleteFinalEntities(Connection conn, int count, Object[] params) {
    String sql = "DELETE f FROM " + tables().finalEntities() + " f" +
        " JOIN " + tables().entities() + " e ON f.entity_id = e.entity_id" +
        " WHERE " + refCondition("e.entity_ref", count);
    return JdbcTemplate.update(conn, sql, params);
  }

  @Override
  protected int markSentinel(Connection conn, int count, Object[] params) {
    String sentinel = ReprocessingSignal.SENTINEL_HASH_VALUE;
    String finalSql = "UPDATE " + tables().finalEntities() + " f" +
        " JOIN " + tables().entities() + " e ON f.entity_id = e.entity_id" +
        " SET f.hash = ?" +
        " WHERE " + refCondition("e.entity_ref", count);
    JdbcTemplate.update(conn, finalSql, prepend(params, sentinel));

    String entitySql = "UPDATE " + tables().entities() + " SET result_hash = ?" +
        " WHERE (result_hash IS NULL OR result_hash <> ?) AND " +
        refCondition("entity_ref", count);
    return JdbcTemplate.update(conn, entitySql, prepend(params, sentinel, sentinel));
  }
}
