package io.intellixity.dblink.proxy.config;

import io.intellixity.dblink.jdbc.JdbcDatabaseEngine;
import io.intellixity.dblink.mongo.MongoDatabaseEngine;
import io.intellixity.dblink.spi.exec.AbstractDatabaseEngine;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "dblink")
public class DblinkProperties {
  private final Bridge bridge = new Bridge();
  private final Dispatcher dispatcher = new Dispatcher();
  private final Jdbc jdbc = new Jdbc();
  private final Mongo mongo = new Mongo();

  /** How long disconnect waits for running operations before closing the client anyway. */
  private Duration disconnectGrace = AbstractDatabaseEngine.DEFAULT_DISCONNECT_GRACE;

  public Bridge getBridge() { return bridge; }
  public Dispatcher getDispatcher() { return dispatcher; }
  public Jdbc getJdbc() { return jdbc; }
  public Mongo getMongo() { return mongo; }
  public Duration getDisconnectGrace() { return disconnectGrace; }
  public void setDisconnectGrace(Duration disconnectGrace) { this.disconnectGrace = disconnectGrace; }

  public static class Bridge {
    /** 0 sizes the pool to the machine, and never below the dispatcher thread count. */
    private int threads;
    private int queueCapacity = ExecutionBridge.DEFAULT_QUEUE_CAPACITY;
    private Duration defaultTimeout = ExecutionBridge.DEFAULT_TIMEOUT;

    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }
    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    public Duration getDefaultTimeout() { return defaultTimeout; }
    public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
  }

  public static class Dispatcher {
    private int threads = 8;
    private int queueCapacity = 256;

    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }
    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
  }

  public static class Jdbc {
    private int maxRows = JdbcDatabaseEngine.DEFAULT_MAX_ROWS;

    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
  }

  public static class Mongo {
    private int maxRows = MongoDatabaseEngine.DEFAULT_MAX_ROWS;
    private int sampleSize = MongoDatabaseEngine.DEFAULT_SAMPLE_SIZE;

    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
  }
}
