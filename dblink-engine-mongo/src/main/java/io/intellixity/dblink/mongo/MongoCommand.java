package io.intellixity.dblink.mongo;

import io.intellixity.dblink.error.QuerySyntaxException;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonValue;
import org.bson.json.JsonParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed form of the JSON query text accepted by the Mongo engine.
 * <p>
 * Accepted shapes:
 * <pre>
 * {"collection": "users", "filter": {...}, "sort": {...}, "projection": {...}, "skip": 0, "limit": 10}
 * {"collection": "users", "pipeline": [{...}, ...]}
 * {"command": {...}}
 * {...}   a bare filter, run against the caller's selected collection
 * </pre>
 */
public record MongoCommand(Kind kind,
                           String collection,
                           BsonDocument filter,
                           BsonDocument sort,
                           BsonDocument projection,
                           Integer skip,
                           Integer limit,
                           List<BsonDocument> pipeline,
                           BsonDocument command) {
  public enum Kind {
    FIND,
    AGGREGATE,
    COMMAND
  }

  public static MongoCommand parse(String query, String contextCollection) {
    BsonDocument doc = parseDocument(query);

    if (doc.containsKey("command")) {
      return new MongoCommand(Kind.COMMAND, null, null, null, null, null, null, null,
          document(doc, "command", true));
    }

    if (!doc.containsKey("collection")) {
      if (contextCollection == null || contextCollection.isBlank()) {
        throw new QuerySyntaxException("Query has no \"collection\" and no collection is selected");
      }
      return new MongoCommand(Kind.FIND, contextCollection, doc, null, null, null, null, null, null);
    }

    BsonValue c = doc.get("collection");
    if (!c.isString() || c.asString().getValue().isBlank()) {
      throw new QuerySyntaxException("\"collection\" must be a non-empty string");
    }
    String collection = c.asString().getValue();

    if (doc.containsKey("pipeline")) {
      BsonValue p = doc.get("pipeline");
      if (!p.isArray()) throw new QuerySyntaxException("\"pipeline\" must be an array of stages");
      List<BsonDocument> stages = new ArrayList<>(p.asArray().size());
      for (BsonValue stage : p.asArray()) {
        if (!stage.isDocument()) throw new QuerySyntaxException("Pipeline stages must be documents");
        stages.add(stage.asDocument());
      }
      return new MongoCommand(Kind.AGGREGATE, collection, null, null, null, null, null, stages, null);
    }

    BsonDocument filter = document(doc, "filter", false);
    return new MongoCommand(Kind.FIND,
        collection,
        (filter == null) ? new BsonDocument() : filter,
        document(doc, "sort", false),
        document(doc, "projection", false),
        count(doc, "skip"),
        count(doc, "limit"),
        null,
        null);
  }

  private static BsonDocument parseDocument(String query) {
    if (query == null || query.isBlank()) throw new QuerySyntaxException("Query is empty");
    try {
      return BsonDocument.parse(query);
    } catch (JsonParseException | BsonInvalidOperationException | IllegalArgumentException e) {
      // bad literals inside extended JSON (ObjectId hex, NumberLong) surface as IllegalArgumentException
      throw new QuerySyntaxException("Malformed query document: " + e.getMessage(), e);
    }
  }

  private static BsonDocument document(BsonDocument doc, String key, boolean required) {
    BsonValue v = doc.get(key);
    if (v == null) {
      if (required) throw new QuerySyntaxException("\"" + key + "\" is required");
      return null;
    }
    if (!v.isDocument()) throw new QuerySyntaxException("\"" + key + "\" must be a document");
    return v.asDocument();
  }

  private static Integer count(BsonDocument doc, String key) {
    BsonValue v = doc.get(key);
    if (v == null) return null;
    if (!v.isNumber()) throw new QuerySyntaxException("\"" + key + "\" must be a number");
    long n = v.asNumber().longValue();
    if (n < 0 || n > Integer.MAX_VALUE) throw new QuerySyntaxException("\"" + key + "\" out of range: " + n);
    return (int) n;
  }
}
