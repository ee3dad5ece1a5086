/**
 * Runs orphan collection inside Spring-managed transactions.
 *
 * @see entitygc.spring.SpringTxContext
 */
package entitygc.spring;
