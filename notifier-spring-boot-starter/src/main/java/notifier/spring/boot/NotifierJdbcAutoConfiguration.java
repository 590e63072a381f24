package notifier.spring.boot;

import notifier.jdbc.ConnectionProvider;
import notifier.jdbc.DataSourceConnectionProvider;
import notifier.jdbc.JdbcDeferredDispatchStore;
import notifier.jdbc.JdbcDispatchRecordStore;
import notifier.jdbc.JdbcSchema;
import notifier.jdbc.JdbcScheduleStore;
import notifier.jdbc.TableNames;
import notifier.spi.DeferredDispatchStore;
import notifier.spi.DispatchRecordStore;
import notifier.spi.ScheduleStore;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the JDBC stores.
 *
 * <p>Active when {@code notifier-jdbc} is on the classpath and a {@link DataSource} bean
 * exists. Runs before {@link NotifierAutoConfiguration} so the stores are injected into
 * the schedule registry and the dispatch engine. Set
 * {@code notifier.jdbc.initialize-schema=true} to create missing tables on startup.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class, before = NotifierAutoConfiguration.class)
@ConditionalOnClass(JdbcScheduleStore.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "notifier.jdbc", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(NotifierProperties.class)
public class NotifierJdbcAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider notifierConnectionProvider(DataSource dataSource, NotifierProperties props) {
    return new DataSourceConnectionProvider(dataSource, props.getJdbc().getSchema());
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcSchema notifierJdbcSchema(ConnectionProvider connectionProvider, NotifierProperties props) {
    NotifierProperties.Jdbc jdbc = props.getJdbc();
    JdbcSchema schema = new JdbcSchema(new TableNames(jdbc.getScheduleTable(), jdbc.getDeferredTable(),
        jdbc.getRecordTable(), jdbc.getOutcomeTable()));
    if (jdbc.isInitializeSchema()) {
      schema.createTables(connectionProvider);
    }
    return schema;
  }

  @Bean
  @ConditionalOnMissingBean(ScheduleStore.class)
  public JdbcScheduleStore scheduleStore(ConnectionProvider connectionProvider, JdbcSchema schema,
      NotifierProperties props) {
    return new JdbcScheduleStore(connectionProvider, props.getJdbc().getScheduleTable());
  }

  @Bean
  @ConditionalOnMissingBean(DeferredDispatchStore.class)
  public JdbcDeferredDispatchStore deferredDispatchStore(ConnectionProvider connectionProvider, JdbcSchema schema,
      NotifierProperties props) {
    return new JdbcDeferredDispatchStore(connectionProvider, props.getJdbc().getDeferredTable());
  }

  @Bean
  @ConditionalOnMissingBean(DispatchRecordStore.class)
  public JdbcDispatchRecordStore dispatchRecordStore(ConnectionProvider connectionProvider, JdbcSchema schema,
      NotifierProperties props) {
    NotifierProperties.Jdbc jdbc = props.getJdbc();
    return new JdbcDispatchRecordStore(connectionProvider, jdbc.getRecordTable(), jdbc.getOutcomeTable());
  }
}
