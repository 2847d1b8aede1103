package io.intellixity.dblink.mongo;

import io.intellixity.dblink.error.QuerySyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MongoCommandTest {
  @Test
  void parsesFind() {
    MongoCommand c = MongoCommand.parse(
        "{\"collection\": \"users\", \"filter\": {\"age\": {\"$gt\": 25}}, \"sort\": {\"age\": -1}, \"skip\": 5, \"limit\": 10}",
        null);
    assertEquals(MongoCommand.Kind.FIND, c.kind());
    assertEquals("users", c.collection());
    assertEquals(25, c.filter().getDocument("age").getInt32("$gt").getValue());
    assertEquals(-1, c.sort().getInt32("age").getValue());
    assertEquals(5, c.skip());
    assertEquals(10, c.limit());
    assertNull(c.projection());
  }

  @Test
  void findWithoutFilterMatchesEverything() {
    MongoCommand c = MongoCommand.parse("{\"collection\": \"users\"}", null);
    assertTrue(c.filter().isEmpty());
    assertNull(c.limit());
  }

  @Test
  void parsesAggregate() {
    MongoCommand c = MongoCommand.parse(
        "{\"collection\": \"orders\", \"pipeline\": [{\"$match\": {}}, {\"$count\": \"n\"}]}", null);
    assertEquals(MongoCommand.Kind.AGGREGATE, c.kind());
    assertEquals(2, c.pipeline().size());
  }

  @Test
  void parsesCommand() {
    MongoCommand c = MongoCommand.parse("{\"command\": {\"dbStats\": 1}}", null);
    assertEquals(MongoCommand.Kind.COMMAND, c.kind());
    assertTrue(c.command().containsKey("dbStats"));
  }

  @Test
  void bareFilterUsesSelectedCollection() {
    MongoCommand c = MongoCommand.parse("{\"status\": \"active\"}", "accounts");
    assertEquals(MongoCommand.Kind.FIND, c.kind());
    assertEquals("accounts", c.collection());
    assertEquals("active", c.filter().getString("status").getValue());
  }

  @Test
  void bareFilterWithoutCollectionIsRejected() {
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"status\": \"active\"}", null));
  }

  @Test
  void malformedJsonIsSyntaxError() {
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"age\": {\"$gt\": }", "users"));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("not json", "users"));
  }

  @Test
  void badExtendedJsonLiteralsAreSyntaxErrors() {
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"a\": ObjectId(\"zz\")}", "users"));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"a\": {\"$oid\": \"zz\"}}", "users"));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"a\": NumberLong(\"x\")}", "users"));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"a\": NumberDecimal(\"x\")}", "users"));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"a\": {\"$date\": \"garbage\"}}", "users"));
  }

  @Test
  void structuralErrorsAreSyntaxErrors() {
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"collection\": 5}", null));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"collection\": \"c\", \"filter\": 1}", null));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"collection\": \"c\", \"pipeline\": {}}", null));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"collection\": \"c\", \"pipeline\": [1]}", null));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"collection\": \"c\", \"limit\": -1}", null));
    assertThrows(QuerySyntaxException.class, () -> MongoCommand.parse("{\"command\": \"ping\"}", null));
  }
}
