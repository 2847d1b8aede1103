package io.intellixity.dblink.mongo;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.dblink.model.DbColumnInfo;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Infers tabular columns from heterogeneous documents and aligns documents to them.
 * <p>
 * A column's type is the sorted set of observed BSON type names joined with {@code " | "}. A column
 * is nullable when some document lacks the field or holds null there. {@code _id} always comes
 * first and is the primary key.
 */
final class DocumentColumns {
  static final String ID = "_id";

  private DocumentColumns() {}

  /** Key order of first appearance. */
  static List<DbColumnInfo> inOrderSeen(List<BsonDocument> docs) {
    return build(docs, false);
  }

  /** Keys sorted by name. */
  static List<DbColumnInfo> byName(List<BsonDocument> docs) {
    return build(docs, true);
  }

  static List<List<JsonNode>> rows(List<BsonDocument> docs, List<DbColumnInfo> columns) {
    List<List<JsonNode>> rows = new ArrayList<>(docs.size());
    for (BsonDocument d : docs) {
      List<JsonNode> row = new ArrayList<>(columns.size());
      for (DbColumnInfo c : columns) row.add(BsonValues.toJson(d.get(c.name())));
      rows.add(row);
    }
    return rows;
  }

  private static List<DbColumnInfo> build(List<BsonDocument> docs, boolean sortByName) {
    Map<String, Field> fields = new LinkedHashMap<>();
    for (BsonDocument d : docs) {
      for (Map.Entry<String, BsonValue> e : d.entrySet()) {
        Field f = fields.computeIfAbsent(e.getKey(), k -> new Field());
        f.present++;
        f.types.add(BsonValues.typeName(e.getValue()));
        if (e.getValue().isNull()) f.sawNull = true;
      }
    }

    List<String> names = new ArrayList<>(fields.keySet());
    if (sortByName) names.sort(null);
    if (names.remove(ID)) names.add(0, ID);

    List<DbColumnInfo> out = new ArrayList<>(names.size());
    for (String name : names) {
      Field f = fields.get(name);
      boolean nullable = f.sawNull || f.present < docs.size();
      out.add(new DbColumnInfo(name, String.join(" | ", f.types), nullable, ID.equals(name), null));
    }
    return out;
  }

  private static final class Field {
    int present;
    boolean sawNull;
    final TreeSet<String> types = new TreeSet<>();
  }
}
