package io.intellixity.dblink.mongo;

import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import io.intellixity.dblink.error.ConnectionException;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.DbTimeoutException;
import io.intellixity.dblink.error.DriverException;
import io.intellixity.dblink.error.QuerySyntaxException;
import org.bson.json.JsonParseException;

import java.util.Set;

/** Maps MongoDB driver failures to caller-facing error kinds. */
final class MongoErrors {
  // BadValue, FailedToParse, and the legacy invalid-operator codes.
  private static final Set<Integer> SYNTAX_CODES = Set.of(2, 9, 15974, 17287);

  private MongoErrors() {}

  static DbException translate(Exception e) {
    if (e instanceof DbException de) return de;
    if (e instanceof JsonParseException) return new QuerySyntaxException(e.getMessage(), e);
    if (e instanceof MongoExecutionTimeoutException) return new DbTimeoutException(e.getMessage(), e);
    if (e instanceof MongoSecurityException) return new ConnectionException(e.getMessage(), e, true);
    if (e instanceof MongoTimeoutException || e instanceof MongoSocketException) {
      return new ConnectionException(e.getMessage(), e);
    }
    if (e instanceof MongoServerException se) {
      if (SYNTAX_CODES.contains(se.getCode())) return new QuerySyntaxException(se.getMessage(), se);
      return new DriverException(se.getMessage(), String.valueOf(se.getCode()), se);
    }
    // the driver asserts "state should be: open" once the client is closed
    if (e instanceof IllegalStateException && String.valueOf(e.getMessage()).contains("state should be: open")) {
      return new ConnectionException("Client is closed", e);
    }
    return new DriverException(String.valueOf(e.getMessage()), e);
  }
}
