/**
 * JDBC-based {@link entitygc.spi.GraphStore} implementations.
 *
 * <p>{@link entitygc.jdbc.store.AbstractJdbcGraphStore} provides shared SQL and
 * reference chunking; subclasses supply database-specific statements: H2
 * (portable SQL), MySQL ({@code DELETE...JOIN}), and PostgreSQL
 * ({@code = ANY(?)} array binding).
 *
 * @see entitygc.jdbc.store.AbstractJdbcGraphStore
 * @see entitygc.jdbc.store.H2GraphStore
 * @see entitygc.jdbc.store.MySqlGraphStore
 * @see entitygc.jdbc.store.PostgresGraphStore
 * @see entitygc.jdbc.store.JdbcGraphStores
 */
package entitygc.jdbc.store;
