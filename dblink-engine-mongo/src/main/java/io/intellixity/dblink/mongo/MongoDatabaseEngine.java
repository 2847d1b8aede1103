package io.intellixity.dblink.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.MongoIterable;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.error.NotFoundException;
import io.intellixity.dblink.model.DbColumnInfo;
import io.intellixity.dblink.model.DbQueryResult;
import io.intellixity.dblink.model.DbSchema;
import io.intellixity.dblink.model.DbTableInfo;
import io.intellixity.dblink.model.DbTableStructure;
import io.intellixity.dblink.model.DbType;
import io.intellixity.dblink.model.TableKind;
import io.intellixity.dblink.spi.exec.AbstractDatabaseEngine;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Document engine using the official MongoDB Java sync driver.
 * <p>
 * Collections are read as {@link BsonDocument}s so every value keeps its BSON type through
 * normalization.
 */
public final class MongoDatabaseEngine extends AbstractDatabaseEngine<MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoDatabaseEngine.class);

  public static final int DEFAULT_MAX_ROWS = 1000;
  public static final int DEFAULT_SAMPLE_SIZE = 100;

  private final MongoDatabase db;
  private final int maxRows;
  private final int sampleSize;

  public MongoDatabaseEngine(MongoHandle handle,
                             ExecutionBridge bridge,
                             Duration defaultTimeout,
                             Duration disconnectGrace,
                             int maxRows,
                             int sampleSize) {
    super(DbType.MONGODB, handle, bridge, defaultTimeout, disconnectGrace);
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
    if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
    this.db = handle.client().getDatabase(handle.database());
    this.maxRows = maxRows;
    this.sampleSize = sampleSize;
  }

  public MongoDatabaseEngine(MongoHandle handle, ExecutionBridge bridge) {
    this(handle, bridge, null, null, DEFAULT_MAX_ROWS, DEFAULT_SAMPLE_SIZE);
  }

  @Override
  protected DbSchema fetchSchema() {
    List<DbTableInfo> tables = new ArrayList<>();
    for (Document info : db.listCollections()) {
      String name = info.getString("name");
      TableKind kind = collectionKind(info.getString("type"));
      Long count = (kind == TableKind.COLLECTION) ? estimatedCount(collection(name)) : null;
      tables.add(new DbTableInfo(name, null, kind, count));
    }
    tables.sort(Comparator.comparing(DbTableInfo::name));
    return new DbSchema(tables);
  }

  /**
   * Skip and limit go to the server as-is. {@code limit == 0} returns an empty page after the
   * collection lookup, since Mongo reads a zero limit as "no limit".
   */
  @Override
  protected DbQueryResult fetchTableData(String table, long offset, long limit) {
    if (offset > Integer.MAX_VALUE) throw new InvalidArgumentException("offset too large: " + offset);
    MongoCollection<BsonDocument> col = existing(table);
    if (limit == 0) return DbQueryResult.empty();
    int lim = (int) Math.min(limit, Integer.MAX_VALUE);

    long start = System.nanoTime();
    Long total = estimatedCount(col);
    debugFind("PAGE", table, offset, lim);
    List<BsonDocument> docs = col.find().skip((int) offset).limit(lim).into(new ArrayList<>());

    List<DbColumnInfo> columns = DocumentColumns.inOrderSeen(docs);
    boolean hasMore = (total != null) ? offset + docs.size() < total : docs.size() == lim;
    return new DbQueryResult(columns, DocumentColumns.rows(docs, columns), null, total, elapsedMillis(start), hasMore);
  }

  @Override
  protected DbTableStructure fetchTableStructure(String table) {
    MongoCollection<BsonDocument> col = existing(table);
    List<BsonDocument> sample = col.find().limit(sampleSize).into(new ArrayList<>());
    return new DbTableStructure(table, DocumentColumns.byName(sample));
  }

  @Override
  protected DbQueryResult runQuery(String query, String contextTable) {
    MongoCommand cmd = MongoCommand.parse(query, contextTable);
    long start = System.nanoTime();

    if (cmd.kind() == MongoCommand.Kind.COMMAND) {
      BsonDocument reply = db.runCommand(cmd.command(), BsonDocument.class);
      List<BsonDocument> docs = List.of(reply);
      List<DbColumnInfo> columns = DocumentColumns.inOrderSeen(docs);
      return new DbQueryResult(columns, DocumentColumns.rows(docs, columns), null, 1L, elapsedMillis(start), false);
    }

    MongoCollection<BsonDocument> col = collection(cmd.collection());
    MongoIterable<BsonDocument> it;
    int cap;
    boolean capped;
    if (cmd.kind() == MongoCommand.Kind.AGGREGATE) {
      it = col.aggregate(cmd.pipeline());
      cap = maxRows;
      capped = true;
    } else {
      FindIterable<BsonDocument> find = col.find(cmd.filter());
      if (cmd.projection() != null) find = find.projection(cmd.projection());
      if (cmd.sort() != null) find = find.sort(cmd.sort());
      if (cmd.skip() != null) find = find.skip(cmd.skip());
      boolean explicitLimit = cmd.limit() != null && cmd.limit() > 0;
      cap = explicitLimit ? cmd.limit() : maxRows;
      capped = !explicitLimit;
      find = find.limit(capped ? maxRows + 1 : cap);
      it = find;
    }
    debugFind(cmd.kind().name(), cmd.collection(), cmd.skip() == null ? 0 : cmd.skip(), cap);

    List<BsonDocument> docs = new ArrayList<>();
    boolean truncated = false;
    try (MongoCursor<BsonDocument> cursor = it.iterator()) {
      while (cursor.hasNext()) {
        BsonDocument d = cursor.next();
        if (docs.size() >= cap) {
          truncated = capped;
          break;
        }
        docs.add(d);
      }
    }

    List<DbColumnInfo> columns = DocumentColumns.inOrderSeen(docs);
    Long total = truncated ? null : (long) docs.size();
    return new DbQueryResult(columns, DocumentColumns.rows(docs, columns), null, total, elapsedMillis(start), truncated);
  }

  @Override
  protected void ping() {
    db.runCommand(new BsonDocument("ping", new BsonInt32(1)));
  }

  @Override
  protected void closeClient() {
    handle().client().close();
  }

  @Override
  protected DbException translate(Exception e) {
    return MongoErrors.translate(e);
  }

  static TableKind collectionKind(String type) {
    if (type == null || "collection".equals(type)) return TableKind.COLLECTION;
    if ("view".equals(type)) return TableKind.VIEW;
    return TableKind.OTHER;
  }

  private MongoCollection<BsonDocument> collection(String name) {
    return db.getCollection(name, BsonDocument.class);
  }

  private MongoCollection<BsonDocument> existing(String name) {
    Document found = db.listCollections().filter(new BsonDocument("name", new BsonString(name))).first();
    if (found == null) throw new NotFoundException("Collection not found: " + name);
    return collection(name);
  }

  // Metadata only; a failure here leaves the count unknown rather than failing the read.
  private Long estimatedCount(MongoCollection<BsonDocument> col) {
    try {
      return col.estimatedDocumentCount();
    } catch (MongoException e) {
      log.debug("dblink.mongo count_unavailable handleId={} collection={} message={}",
          handle().id(), col.getNamespace().getCollectionName(), e.getMessage());
      return null;
    }
  }

  private void debugFind(String op, String collection, long skip, long limit) {
    if (!log.isDebugEnabled()) return;
    log.debug("dblink.mongo op={} handleId={} database={} collection={} skip={} limit={}",
        op, handle().id(), handle().database(), collection, skip, limit);
  }
}
