/**
 * Spring Boot auto-configuration for the orphan collector.
 *
 * <p>Properties live under the {@code entitygc} prefix; see
 * {@link entitygc.spring.boot.EntityGcProperties}.
 */
package entitygc.spring.boot;
