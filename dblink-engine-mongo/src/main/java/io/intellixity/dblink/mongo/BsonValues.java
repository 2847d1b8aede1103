package io.intellixity.dblink.mongo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.dblink.model.JsonValues;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonRegularExpression;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;

import java.time.Instant;
import java.util.Map;

/** BSON to normalized cell values, plus the type names used for inferred columns. */
public final class BsonValues {
  private BsonValues() {}

  public static JsonNode toJson(BsonValue v) {
    if (v == null) return JsonValues.nullValue();
    switch (v.getBsonType()) {
      case NULL:
      case UNDEFINED:
        return JsonValues.nullValue();
      case BOOLEAN:
        return JsonValues.nodes().booleanNode(v.asBoolean().getValue());
      case INT32:
        return JsonValues.nodes().numberNode(v.asInt32().getValue());
      case INT64:
        return JsonValues.nodes().numberNode(v.asInt64().getValue());
      case DOUBLE:
        return JsonValues.number(v.asDouble().getValue());
      case DECIMAL128:
        return JsonValues.text(v.asDecimal128().getValue().toString());
      case STRING:
        return JsonValues.text(v.asString().getValue());
      case OBJECT_ID:
        return JsonValues.text(v.asObjectId().getValue().toHexString());
      case DATE_TIME:
        return JsonValues.text(Instant.ofEpochMilli(v.asDateTime().getValue()).toString());
      case DOCUMENT:
        return toJson(v.asDocument());
      case ARRAY:
        return toJson(v.asArray());
      case BINARY:
        return JsonValues.binary(v.asBinary().getData().length);
      case REGULAR_EXPRESSION: {
        BsonRegularExpression re = v.asRegularExpression();
        return JsonValues.text("/" + re.getPattern() + "/" + re.getOptions());
      }
      case TIMESTAMP: {
        BsonTimestamp ts = v.asTimestamp();
        return JsonValues.text("Timestamp(" + ts.getTime() + ", " + ts.getInc() + ")");
      }
      case SYMBOL:
        return JsonValues.text(v.asSymbol().getSymbol());
      case JAVASCRIPT:
        return JsonValues.text(v.asJavaScript().getCode());
      default:
        return JsonValues.text(String.valueOf(v));
    }
  }

  public static ObjectNode toJson(BsonDocument doc) {
    ObjectNode out = JsonValues.nodes().objectNode();
    for (Map.Entry<String, BsonValue> e : doc.entrySet()) out.set(e.getKey(), toJson(e.getValue()));
    return out;
  }

  public static ArrayNode toJson(BsonArray array) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (BsonValue v : array) out.add(toJson(v));
    return out;
  }

  /** Display name of a value's BSON type ("int32", "string", "ObjectId", ...). */
  public static String typeName(BsonValue v) {
    if (v == null) return "null";
    switch (v.getBsonType()) {
      case NULL: return "null";
      case UNDEFINED: return "undefined";
      case BOOLEAN: return "bool";
      case INT32: return "int32";
      case INT64: return "int64";
      case DOUBLE: return "double";
      case DECIMAL128: return "decimal128";
      case STRING: return "string";
      case OBJECT_ID: return "ObjectId";
      case DATE_TIME: return "DateTime";
      case DOCUMENT: return "Document";
      case ARRAY: return "Array";
      case BINARY: return "Binary";
      case REGULAR_EXPRESSION: return "Regex";
      case TIMESTAMP: return "Timestamp";
      default: return "unknown";
    }
  }
}
