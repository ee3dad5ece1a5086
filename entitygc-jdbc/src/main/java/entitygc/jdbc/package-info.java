/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link entitygc.jdbc.JdbcTemplate} provides lightweight JDBC helpers and
 * {@link entitygc.jdbc.GraphTables} holds validated table names.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code entitygc.jdbc.store}: {@link entitygc.spi.GraphStore} implementations</li>
 *   <li>{@code entitygc.jdbc.tx}: manual transaction management</li>
 * </ul>
 */
package entitygc.jdbc;
