package io.intellixity.dblink.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

/** Shared building blocks for normalized cell values. */
public final class JsonValues {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private JsonValues() {}

  public static JsonNodeFactory nodes() { return NODES; }

  public static JsonNode nullValue() { return NullNode.instance; }

  public static JsonNode text(String s) {
    return (s == null) ? NullNode.instance : NODES.textNode(s);
  }

  /** JSON has no NaN/Infinity, so non-finite doubles become their text form. */
  public static JsonNode number(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) return NODES.textNode(Double.toString(d));
    return NODES.numberNode(d);
  }

  public static JsonNode binary(int length) {
    return NODES.textNode("<binary " + length + " bytes>");
  }
}
