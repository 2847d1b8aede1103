package io.intellixity.dblink.manager;

import io.intellixity.dblink.error.ConnectionException;
import io.intellixity.dblink.error.DbTimeoutException;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.error.NotFoundException;
import io.intellixity.dblink.exec.DatabaseEngine;
import io.intellixity.dblink.exec.EngineHandle;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.ConnectionSpec;
import io.intellixity.dblink.model.DbQueryResult;
import io.intellixity.dblink.model.DbSchema;
import io.intellixity.dblink.model.DbTableStructure;
import io.intellixity.dblink.model.DbType;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionManagerTest {

  private record TestHandle(String id, String namespace) implements EngineHandle<Object> {
    @Override public Object client() { return this; }
  }

  private static final class TestEngine implements DatabaseEngine {
    private final TestHandle handle;
    private final DbType type;
    private final RuntimeException connectFailure;
    final AtomicInteger disconnects = new AtomicInteger();
    volatile RuntimeException queryFailure;

    TestEngine(ConnectionId id, DbType type, RuntimeException connectFailure) {
      this.handle = new TestHandle(id.value(), "db");
      this.type = type;
      this.connectFailure = connectFailure;
    }

    @Override public DbType type() { return type; }
    @Override public EngineHandle<?> handle() { return handle; }
    @Override public DbSchema getSchema(Duration timeout) { return new DbSchema(List.of()); }
    @Override public DbQueryResult getTableData(String table, long offset, long limit, Duration timeout) { return DbQueryResult.empty(); }
    @Override public DbTableStructure getTableStructure(String table, Duration timeout) { return new DbTableStructure(table, List.of()); }
    @Override public DbQueryResult executeQuery(String query, Duration timeout) { return executeQuery(query, null, timeout); }

    @Override
    public DbQueryResult executeQuery(String query, String contextTable, Duration timeout) {
      if (queryFailure != null) throw queryFailure;
      return DbQueryResult.ofUpdate(1L, 0);
    }

    @Override public boolean testConnection(Duration timeout) { return connectFailure == null; }

    @Override
    public void checkConnectivity(Duration timeout) {
      if (connectFailure != null) throw connectFailure;
    }

    @Override public void disconnect() { disconnects.incrementAndGet(); }
    @Override public boolean isOpen() { return disconnects.get() == 0; }
  }

  private final ExecutionBridge bridge = new ExecutionBridge(2, 16, Duration.ofSeconds(5));
  private final List<TestEngine> created = new ArrayList<>();
  private volatile RuntimeException nextConnectFailure;

  private final ConnectionManager manager = new ConnectionManager(
      EngineFactories.builder()
          .register(DbType.POSTGRES, this::create)
          .register(DbType.MONGODB, this::create)
          .build(),
      bridge);

  private volatile ConnectionId gatedId;
  private final CountDownLatch gateEntered = new CountDownLatch(1);
  private final CountDownLatch gate = new CountDownLatch(1);

  private TestEngine create(ConnectionId id, ConnectionSpec spec, ExecutionBridge b) {
    assertSame(bridge, b);
    if (id.equals(gatedId)) {
      gateEntered.countDown();
      try {
        assertTrue(gate.await(5, TimeUnit.SECONDS));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
    }
    synchronized (created) {
      TestEngine e = new TestEngine(id, spec.type(), nextConnectFailure);
      created.add(e);
      return e;
    }
  }

  private static ConnectionSpec pg() {
    return ConnectionSpec.of(DbType.POSTGRES, "localhost", 0, "u", "p", "db");
  }

  @AfterEach
  void tearDown() {
    manager.close();
    bridge.close();
  }

  @Test
  void openRegistersUnderFreshId() {
    ConnectionId a = manager.open(pg());
    ConnectionId b = manager.open(pg());
    assertNotEquals(a, b);
    assertEquals(DbType.POSTGRES, manager.get(a).type());
    assertEquals(2, manager.size());
  }

  @Test
  void callerChosenIdMustBeFree() {
    ConnectionId id = ConnectionId.of("mine");
    manager.open(id, pg());
    assertThrows(InvalidArgumentException.class, () -> manager.open(id, pg()));
    assertEquals(1, created.size());

    manager.close(id);
    manager.open(id, pg());
    assertTrue(manager.get(id).isOpen());
  }

  @Test
  void failedConnectRegistersNothingAndReleasesEngine() {
    nextConnectFailure = new ConnectionException("Connection refused");
    ConnectionId id = ConnectionId.of("down");
    ConnectionException e = assertThrows(ConnectionException.class, () -> manager.open(id, pg()));
    assertEquals("Connection refused", e.getMessage());

    assertThrows(NotFoundException.class, () -> manager.get(id));
    assertEquals(1, created.get(0).disconnects.get());
    assertEquals(0, manager.size());

    // the id is free again
    nextConnectFailure = null;
    manager.open(id, pg());
    assertTrue(manager.get(id).isOpen());
  }

  @Test
  void closeAllAfterFailedOpenTouchesNothing() {
    nextConnectFailure = new ConnectionException("Connection refused");
    assertThrows(ConnectionException.class, () -> manager.open(pg()));
    assertEquals(0, manager.closeAll());
    assertEquals(1, created.get(0).disconnects.get());
  }

  @Test
  void otherConnectFailuresBecomeConnectionErrors() {
    nextConnectFailure = new DbTimeoutException("timed out");
    ConnectionException e = assertThrows(ConnectionException.class, () -> manager.open(pg()));
    assertInstanceOf(DbTimeoutException.class, e.getCause());
  }

  @Test
  void unknownBackendIsInvalidArgument() {
    ConnectionManager onlyPg = new ConnectionManager(
        EngineFactories.builder().register(DbType.POSTGRES, this::create).build(), bridge);
    ConnectionSpec mongo = ConnectionSpec.of(DbType.MONGODB, "h", 0, "", "", "db");
    assertThrows(InvalidArgumentException.class, () -> onlyPg.open(mongo));
    assertEquals(0, onlyPg.size());
  }

  @Test
  void assignedIdsSkipIdsStillOpening() throws Exception {
    ConnectionId first = manager.open(pg());
    long n = Long.parseLong(first.value().substring("conn-".length()));
    ConnectionId taken = ConnectionId.of("conn-" + (n + 1));
    gatedId = taken;

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<?> pending = pool.submit(() -> manager.open(taken, pg()));
      assertTrue(gateEntered.await(5, TimeUnit.SECONDS));

      ConnectionId next = manager.open(pg());
      assertNotEquals(taken, next);

      gate.countDown();
      pending.get(5, TimeUnit.SECONDS);
    } finally {
      gate.countDown();
      pool.shutdownNow();
    }
    assertEquals(3, manager.size());
    assertTrue(manager.ids().contains(taken));
  }

  @Test
  void getUnknownIsNotFound() {
    assertThrows(NotFoundException.class, () -> manager.get(ConnectionId.of("nope")));
  }

  @Test
  void closeIsIdempotent() {
    ConnectionId id = manager.open(pg());
    assertTrue(manager.close(id));
    assertFalse(manager.close(id));
    assertFalse(manager.close(ConnectionId.of("never-opened")));
    assertEquals(1, created.get(0).disconnects.get());
    assertThrows(NotFoundException.class, () -> manager.get(id));
  }

  @Test
  void closeAllCountsAndRefusesLaterOpens() {
    manager.open(pg());
    manager.open(pg());
    assertEquals(2, manager.closeAll());
    assertEquals(0, manager.closeAll());
    assertTrue(manager.isClosed());
    for (TestEngine e : created) assertEquals(1, e.disconnects.get());
    assertThrows(ConnectionException.class, () -> manager.open(pg()));
  }

  @Test
  void fatalFailureEvicts() {
    ConnectionId id = manager.open(pg());
    TestEngine engine = created.get(0);
    engine.queryFailure = new ConnectionException("password authentication failed", null, true);

    assertThrows(ConnectionException.class, () -> manager.withEngine(id, e -> e.executeQuery("SELECT 1")));
    assertThrows(NotFoundException.class, () -> manager.get(id));
    assertEquals(1, engine.disconnects.get());
  }

  @Test
  void transientFailureKeepsInstance() {
    ConnectionId id = manager.open(pg());
    TestEngine engine = created.get(0);
    engine.queryFailure = new ConnectionException("connection reset");

    assertThrows(ConnectionException.class, () -> manager.withEngine(id, e -> e.executeQuery("SELECT 1")));
    assertSame(engine, manager.get(id));

    engine.queryFailure = null;
    assertEquals(1L, manager.withEngine(id, e -> e.executeQuery("SELECT 1")).affectedRows());
  }

  @Test
  void testConnectionUsesThrowawayEngine() {
    assertTrue(manager.testConnection(pg()));
    nextConnectFailure = new ConnectionException("refused");
    assertFalse(manager.testConnection(pg()));
    assertEquals(0, manager.size());
    for (TestEngine e : created) assertEquals(1, e.disconnects.get());
  }

  @Test
  void concurrentOpensOfSameIdAdmitOne() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch go = new CountDownLatch(1);
    AtomicInteger ok = new AtomicInteger();
    AtomicInteger rejected = new AtomicInteger();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        futures.add(pool.submit(() -> {
          go.await();
          try {
            manager.open(ConnectionId.of("shared"), pg());
            ok.incrementAndGet();
          } catch (InvalidArgumentException e) {
            rejected.incrementAndGet();
          }
          return null;
        }));
      }
      go.countDown();
      for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, ok.get());
    assertEquals(7, rejected.get());
    assertEquals(1, manager.size());
  }
}
