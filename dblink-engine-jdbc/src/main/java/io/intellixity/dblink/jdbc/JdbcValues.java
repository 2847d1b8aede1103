package io.intellixity.dblink.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.intellixity.dblink.model.JsonValues;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.SQLException;

/**
 * Maps objects returned by {@code ResultSet.getObject} to normalized cell values.
 * <p>
 * Decimals and big integers become text so no precision is lost.
 */
public final class JdbcValues {
  private JdbcValues() {}

  public static JsonNode fromObject(Object v) throws SQLException {
    if (v == null) return JsonValues.nullValue();
    if (v instanceof Boolean b) return JsonValues.nodes().booleanNode(b);
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
      return JsonValues.nodes().numberNode(((Number) v).intValue());
    }
    if (v instanceof Long l) return JsonValues.nodes().numberNode(l);
    if (v instanceof Float f) return JsonValues.number(f.doubleValue());
    if (v instanceof Double d) return JsonValues.number(d);
    if (v instanceof BigDecimal bd) return JsonValues.text(bd.toPlainString());
    if (v instanceof BigInteger bi) return JsonValues.text(bi.toString());
    if (v instanceof byte[] bytes) return JsonValues.binary(bytes.length);
    if (v instanceof Array a) return fromObject(a.getArray());
    if (v instanceof Object[] oa) return elements(oa);
    if (v instanceof int[] ia) return primitives(ia);
    if (v instanceof long[] la) return primitives(la);
    if (v instanceof double[] da) return primitives(da);
    if (v instanceof float[] fa) return primitives(fa);
    if (v instanceof short[] sa) return primitives(sa);
    if (v instanceof boolean[] ba) return primitives(ba);
    return JsonValues.text(String.valueOf(v));
  }

  private static JsonNode elements(Object[] a) throws SQLException {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (Object o : a) out.add(fromObject(o));
    return out;
  }

  private static JsonNode primitives(int[] a) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (int x : a) out.add(x);
    return out;
  }

  private static JsonNode primitives(long[] a) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (long x : a) out.add(x);
    return out;
  }

  private static JsonNode primitives(double[] a) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (double x : a) out.add(JsonValues.number(x));
    return out;
  }

  private static JsonNode primitives(float[] a) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (float x : a) out.add(JsonValues.number(x));
    return out;
  }

  private static JsonNode primitives(short[] a) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (short x : a) out.add((int) x);
    return out;
  }

  private static JsonNode primitives(boolean[] a) {
    ArrayNode out = JsonValues.nodes().arrayNode();
    for (boolean x : a) out.add(x);
    return out;
  }
}
