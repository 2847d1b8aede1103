package io.intellixity.dblink.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcValuesTest {
  @Test
  void nullBecomesJsonNull() throws Exception {
    assertTrue(JdbcValues.fromObject(null).isNull());
  }

  @Test
  void integersKeepTheirWidth() throws Exception {
    JsonNode i = JdbcValues.fromObject(42);
    assertTrue(i.isInt());
    assertEquals(42, i.intValue());

    JsonNode s = JdbcValues.fromObject((short) 7);
    assertTrue(s.isInt());

    JsonNode l = JdbcValues.fromObject(9_000_000_000L);
    assertTrue(l.isLong());
    assertEquals(9_000_000_000L, l.longValue());
  }

  @Test
  void decimalsAreTextWithoutPrecisionLoss() throws Exception {
    JsonNode d = JdbcValues.fromObject(new BigDecimal("12345678901234567890.000000001"));
    assertTrue(d.isTextual());
    assertEquals("12345678901234567890.000000001", d.textValue());

    JsonNode bi = JdbcValues.fromObject(new BigInteger("123456789012345678901234567890"));
    assertEquals("123456789012345678901234567890", bi.textValue());
  }

  @Test
  void nonFiniteDoublesBecomeText() throws Exception {
    assertEquals("NaN", JdbcValues.fromObject(Double.NaN).textValue());
    assertEquals("Infinity", JdbcValues.fromObject(Float.POSITIVE_INFINITY).textValue());
    assertEquals(1.5, JdbcValues.fromObject(1.5d).doubleValue());
  }

  @Test
  void bytesBecomePlaceholder() throws Exception {
    assertEquals("<binary 3 bytes>", JdbcValues.fromObject(new byte[] {1, 2, 3}).textValue());
  }

  @Test
  void arraysMapElementwise() throws Exception {
    JsonNode a = JdbcValues.fromObject(new Object[] {1, null, "x"});
    assertTrue(a.isArray());
    assertEquals(3, a.size());
    assertEquals(1, a.get(0).intValue());
    assertTrue(a.get(1).isNull());
    assertEquals("x", a.get(2).textValue());

    JsonNode p = JdbcValues.fromObject(new int[] {4, 5});
    assertEquals(2, p.size());
    assertEquals(5, p.get(1).intValue());
  }

  @Test
  void primitiveArraysKeepElementTypes() throws Exception {
    JsonNode longs = JdbcValues.fromObject(new long[] {9_000_000_000L});
    assertTrue(longs.get(0).isLong());

    JsonNode doubles = JdbcValues.fromObject(new double[] {1.5, Double.NaN});
    assertEquals(1.5, doubles.get(0).doubleValue());
    assertEquals("NaN", doubles.get(1).textValue());

    JsonNode flags = JdbcValues.fromObject(new boolean[] {true, false});
    assertTrue(flags.get(0).booleanValue());
    assertFalse(flags.get(1).booleanValue());

    assertEquals(3, JdbcValues.fromObject(new short[] {3}).get(0).intValue());
    assertEquals(2, JdbcValues.fromObject(new float[] {0.5f, 1f}).size());
  }

  @Test
  void nestedArraysRecurse() throws Exception {
    JsonNode n = JdbcValues.fromObject(new Object[] {new Integer[] {1, 2}, new Integer[] {3}});
    assertEquals(2, n.get(0).size());
    assertEquals(3, n.get(1).get(0).intValue());
  }

  @Test
  void everythingElseUsesStringForm() throws Exception {
    UUID u = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    assertEquals(u.toString(), JdbcValues.fromObject(u).textValue());
    assertTrue(JdbcValues.fromObject(Boolean.TRUE).booleanValue());
  }
}
