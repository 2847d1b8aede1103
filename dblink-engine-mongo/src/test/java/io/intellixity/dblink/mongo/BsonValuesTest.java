package io.intellixity.dblink.mongo;

import com.fasterxml.jackson.databind.JsonNode;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonRegularExpression;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.BsonUndefined;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BsonValuesTest {
  @Test
  void scalars() {
    assertTrue(BsonValues.toJson(BsonNull.VALUE).isNull());
    assertTrue(BsonValues.toJson(new BsonUndefined()).isNull());
    assertTrue(BsonValues.toJson((org.bson.BsonValue) null).isNull());
    assertTrue(BsonValues.toJson(BsonBoolean.TRUE).booleanValue());

    JsonNode i = BsonValues.toJson(new BsonInt32(7));
    assertTrue(i.isInt());
    JsonNode l = BsonValues.toJson(new BsonInt64(7_000_000_000L));
    assertTrue(l.isLong());
    assertEquals(2.5, BsonValues.toJson(new BsonDouble(2.5)).doubleValue());
    assertEquals("NaN", BsonValues.toJson(new BsonDouble(Double.NaN)).textValue());
    assertEquals("hi", BsonValues.toJson(new BsonString("hi")).textValue());
  }

  @Test
  void decimalKeepsPrecisionAsText() {
    JsonNode n = BsonValues.toJson(new BsonDecimal128(new Decimal128(new BigDecimal("1.10"))));
    assertEquals("1.10", n.textValue());
  }

  @Test
  void objectIdAndDate() {
    ObjectId oid = new ObjectId("507f1f77bcf86cd799439011");
    assertEquals("507f1f77bcf86cd799439011", BsonValues.toJson(new BsonObjectId(oid)).textValue());
    assertEquals("1970-01-01T00:00:01Z", BsonValues.toJson(new BsonDateTime(1000)).textValue());
  }

  @Test
  void binaryRegexTimestamp() {
    assertEquals("<binary 4 bytes>", BsonValues.toJson(new BsonBinary(new byte[4])).textValue());
    assertEquals("/^a.*/i", BsonValues.toJson(new BsonRegularExpression("^a.*", "i")).textValue());
    assertEquals("Timestamp(10, 2)", BsonValues.toJson(new BsonTimestamp(10, 2)).textValue());
  }

  @Test
  void nestedDocumentsAndArrays() {
    BsonDocument doc = new BsonDocument("a", new BsonInt32(1))
        .append("tags", new BsonArray(List.of(new BsonString("x"), BsonNull.VALUE)))
        .append("inner", new BsonDocument("b", BsonBoolean.FALSE));
    JsonNode n = BsonValues.toJson(doc);
    assertEquals(1, n.get("a").intValue());
    assertEquals(2, n.get("tags").size());
    assertTrue(n.get("tags").get(1).isNull());
    assertFalse(n.get("inner").get("b").booleanValue());
  }

  @Test
  void typeNames() {
    assertEquals("int32", BsonValues.typeName(new BsonInt32(1)));
    assertEquals("int64", BsonValues.typeName(new BsonInt64(1)));
    assertEquals("string", BsonValues.typeName(new BsonString("s")));
    assertEquals("ObjectId", BsonValues.typeName(new BsonObjectId()));
    assertEquals("null", BsonValues.typeName(BsonNull.VALUE));
    assertEquals("Document", BsonValues.typeName(new BsonDocument()));
  }
}
