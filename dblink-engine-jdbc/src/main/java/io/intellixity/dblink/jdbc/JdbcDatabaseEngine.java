package io.intellixity.dblink.jdbc;

import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.NotFoundException;
import io.intellixity.dblink.jdbc.dialect.JdbcDialect;
import io.intellixity.dblink.model.DbColumnInfo;
import io.intellixity.dblink.model.DbQueryResult;
import io.intellixity.dblink.model.DbSchema;
import io.intellixity.dblink.model.DbTableInfo;
import io.intellixity.dblink.model.DbTableStructure;
import io.intellixity.dblink.spi.exec.AbstractDatabaseEngine;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Relational engine over a pooled JDBC {@link DataSource}; backend specifics come from a
 * {@link JdbcDialect}. Every operation borrows one pooled connection and returns it before
 * completing.
 */
public final class JdbcDatabaseEngine extends AbstractDatabaseEngine<JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseEngine.class);

  public static final int DEFAULT_MAX_ROWS = 1000;

  private final DataSource ds;
  private final JdbcDialect dialect;
  private final int maxRows;

  public JdbcDatabaseEngine(JdbcHandle handle,
                            JdbcDialect dialect,
                            ExecutionBridge bridge,
                            Duration defaultTimeout,
                            Duration disconnectGrace,
                            int maxRows) {
    super(Objects.requireNonNull(dialect, "dialect").type(), handle, bridge, defaultTimeout, disconnectGrace);
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
    this.ds = handle.client();
    this.dialect = dialect;
    this.maxRows = maxRows;
  }

  public JdbcDatabaseEngine(JdbcHandle handle, JdbcDialect dialect, ExecutionBridge bridge) {
    this(handle, dialect, bridge, null, null, DEFAULT_MAX_ROWS);
  }

  public JdbcDialect dialect() { return dialect; }

  @Override
  protected DbSchema fetchSchema() throws SQLException {
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(dialect.listTablesSql());
         ResultSet rs = ps.executeQuery()) {
      List<DbTableInfo> tables = new ArrayList<>();
      while (rs.next()) tables.add(dialect.readTableInfo(rs));
      return new DbSchema(tables);
    }
  }

  @Override
  protected DbQueryResult fetchTableData(String table, long offset, long limit) throws SQLException {
    try (Connection c = ds.getConnection()) {
      TableRef ref = resolve(c, table);
      long start = System.nanoTime();

      long total;
      try (PreparedStatement ps = c.prepareStatement(dialect.countSql(ref));
           ResultSet rs = ps.executeQuery()) {
        total = rs.next() ? rs.getLong(1) : 0L;
      }

      String sql = dialect.pageSql(ref);
      debugSql("PAGE", sql);
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        ps.setLong(1, limit);
        ps.setLong(2, offset);
        try (ResultSet rs = ps.executeQuery()) {
          JdbcRows.Page page = JdbcRows.read(rs, dialect, Integer.MAX_VALUE);
          boolean hasMore = offset + page.rows().size() < total;
          return new DbQueryResult(page.columns(), page.rows(), null, total, elapsedMillis(start), hasMore);
        }
      }
    }
  }

  @Override
  protected DbTableStructure fetchTableStructure(String table) throws SQLException {
    try (Connection c = ds.getConnection()) {
      TableRef ref = resolve(c, table);
      try (PreparedStatement ps = c.prepareStatement(dialect.columnsSql())) {
        ps.setString(1, ref.schema());
        ps.setString(2, ref.name());
        try (ResultSet rs = ps.executeQuery()) {
          List<DbColumnInfo> columns = new ArrayList<>();
          while (rs.next()) columns.add(dialect.readColumn(rs));
          return new DbTableStructure(table, columns);
        }
      }
    }
  }

  /**
   * Runs arbitrary SQL. Whether rows come back is decided by the driver, not by sniffing the
   * statement text; row results are capped at {@code maxRows} with {@code hasMore} on truncation.
   * SQL names its tables itself, so the context table is not used.
   */
  @Override
  protected DbQueryResult runQuery(String query, String contextTable) throws SQLException {
    debugSql("EXECUTE", query);
    try (Connection c = ds.getConnection();
         Statement st = c.createStatement()) {
      st.setMaxRows(maxRows + 1);
      long start = System.nanoTime();
      boolean hasResultSet = st.execute(query);
      if (hasResultSet) {
        try (ResultSet rs = st.getResultSet()) {
          JdbcRows.Page page = JdbcRows.read(rs, dialect, maxRows);
          Long total = page.truncated() ? null : (long) page.rows().size();
          return new DbQueryResult(page.columns(), page.rows(), null, total, elapsedMillis(start), page.truncated());
        }
      }
      int updated = st.getUpdateCount();
      return DbQueryResult.ofUpdate(updated < 0 ? null : (long) updated, elapsedMillis(start));
    }
  }

  @Override
  protected void ping() throws SQLException {
    try (Connection c = ds.getConnection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery(dialect.pingSql())) {
      rs.next();
    }
  }

  @Override
  protected void closeClient() throws Exception {
    if (ds instanceof AutoCloseable closeable) closeable.close();
  }

  @Override
  protected DbException translate(Exception e) {
    return dialect.translate(e);
  }

  /**
   * Resolves a caller-supplied name to an existing relation. {@code "a.b"} is tried as
   * schema-qualified first, then as a literal name containing a dot.
   */
  private TableRef resolve(Connection c, String table) throws SQLException {
    TableRef ref = TableRef.parse(table);
    if (exists(c, ref)) return ref;
    if (ref.qualified()) {
      TableRef literal = new TableRef(null, table);
      if (exists(c, literal)) return literal;
    }
    throw new NotFoundException("Table not found: " + table);
  }

  private boolean exists(Connection c, TableRef ref) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(dialect.tableExistsSql())) {
      ps.setString(1, ref.schema());
      ps.setString(2, ref.name());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  private void debugSql(String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("dblink.jdbc op={} dialect={} handleId={} database={} sql={}",
        op, dialect.id(), handle().id(), handle().database(), sql);
  }
}
