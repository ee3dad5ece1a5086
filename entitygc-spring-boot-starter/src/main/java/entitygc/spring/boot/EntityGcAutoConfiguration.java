package entitygc.spring.boot;

import entitygc.OrphanCollector;
import entitygc.jdbc.DataSourceConnectionProvider;
import entitygc.jdbc.GraphTables;
import entitygc.jdbc.store.AbstractJdbcGraphStore;
import entitygc.jdbc.store.JdbcGraphStores;
import entitygc.spi.ConnectionProvider;
import entitygc.spi.MetricsExporter;
import entitygc.spi.TxContext;
import entitygc.spring.SpringTxContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the orphan collector.
 *
 * <p>Detects the graph store from the {@link DataSource} URL and wires an
 * {@link OrphanCollector} that sweeps inside the caller's Spring transaction.
 * Nothing is scheduled; call {@link OrphanCollector#collect()} from a
 * {@code @Transactional} method.
 *
 * @see EntityGcProperties
 * @see EntityGcMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(OrphanCollector.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EntityGcProperties.class)
public class EntityGcAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcGraphStore graphStore(DataSource dataSource, EntityGcProperties props) {
    GraphTables tables = new GraphTables(
        props.getEntitiesTable(), props.getFinalEntitiesTable(), props.getReferenceEdgesTable());
    return JdbcGraphStores.detect(dataSource, tables, props.getBatchSize());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public OrphanCollector orphanCollector(EntityGcProperties props,
      AbstractJdbcGraphStore graphStore,
      TxContext txContext,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return OrphanCollector.builder()
        .graphStore(graphStore)
        .txContext(txContext)
        .edgeRetention(props.getEdgeRetention())
        .reprocessingSignal(props.getReprocessingSignal())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }
}
