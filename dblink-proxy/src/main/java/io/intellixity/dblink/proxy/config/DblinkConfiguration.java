package io.intellixity.dblink.proxy.config;

import io.intellixity.dblink.jdbc.postgres.PostgresEngines;
import io.intellixity.dblink.manager.ConnectionManager;
import io.intellixity.dblink.manager.EngineFactories;
import io.intellixity.dblink.model.DbType;
import io.intellixity.dblink.mongo.MongoEngines;
import io.intellixity.dblink.proxy.DatabaseDispatcher;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DblinkProperties.class)
public class DblinkConfiguration {

  @Bean(destroyMethod = "close")
  public ExecutionBridge executionBridge(DblinkProperties props) {
    return new ExecutionBridge(bridgeThreads(props), props.getBridge().getQueueCapacity(),
        props.getBridge().getDefaultTimeout());
  }

  /**
   * Every dispatch thread may hold one bridge worker for a whole blocking driver call, so the
   * bridge needs at least as many workers as there are dispatch threads.
   */
  static int bridgeThreads(DblinkProperties props) {
    int dispatch = props.getDispatcher().getThreads();
    int configured = props.getBridge().getThreads();
    if (configured <= 0) {
      return Math.max(dispatch, Math.max(4, Runtime.getRuntime().availableProcessors()));
    }
    if (configured < dispatch) {
      throw new IllegalArgumentException("dblink.bridge.threads (" + configured
          + ") must be at least dblink.dispatcher.threads (" + dispatch + ")");
    }
    return configured;
  }

  @Bean
  public EngineFactories engineFactories(DblinkProperties props) {
    return EngineFactories.builder()
        .register(DbType.POSTGRES, (id, spec, bridge) ->
            PostgresEngines.open(id, spec, bridge, props.getDisconnectGrace(), props.getJdbc().getMaxRows()))
        .register(DbType.MONGODB, (id, spec, bridge) ->
            MongoEngines.open(id, spec, bridge, props.getDisconnectGrace(),
                props.getMongo().getMaxRows(), props.getMongo().getSampleSize()))
        .build();
  }

  @Bean(destroyMethod = "close")
  public ConnectionManager connectionManager(EngineFactories factories, ExecutionBridge bridge) {
    return new ConnectionManager(factories, bridge);
  }

  @Bean(destroyMethod = "close")
  public DatabaseDispatcher databaseDispatcher(ConnectionManager manager, DblinkProperties props) {
    return new DatabaseDispatcher(manager, props.getDispatcher().getThreads(), props.getDispatcher().getQueueCapacity());
  }
}
