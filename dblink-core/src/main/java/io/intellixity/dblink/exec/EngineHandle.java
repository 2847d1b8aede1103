package io.intellixity.dblink.exec;

/**
 * Live native handle owned by one engine instance.
 * <p>
 * Example:
 * <ul>
 *   <li>JDBC: {@code client()} is a pooled {@code javax.sql.DataSource}, {@code namespace()} is the database</li>
 *   <li>Mongo: {@code client()} is a {@code MongoClient}, {@code namespace()} is the database</li>
 * </ul>
 */
public interface EngineHandle<TClient> {
  /** Identifier for this handle, used in logs (usually the connection id). */
  String id();

  /** Native client used by the engine. */
  TClient client();

  /** Database the handle is bound to. */
  String namespace();
}
