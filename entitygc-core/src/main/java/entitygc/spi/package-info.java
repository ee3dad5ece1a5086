/**
 * Service Provider Interfaces (SPI) for plugging the collector into a runtime.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to supply transactions, connections, storage and metrics.
 *
 * @see entitygc.spi.TxContext
 * @see entitygc.spi.ConnectionProvider
 * @see entitygc.spi.GraphStore
 * @see entitygc.spi.MetricsExporter
 */
package entitygc.spi;
