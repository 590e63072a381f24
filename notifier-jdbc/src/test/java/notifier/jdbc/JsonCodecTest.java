package notifier.jdbc;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonCodecTest {

  @Test
  void emptyMapEncodesAsNull() {
    assertNull(JsonCodec.toJson(Map.of()));
    assertNull(JsonCodec.toJson(null));
  }

  @Test
  void escapesSpecialCharacters() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("quote", "say \"hi\"");
    values.put("path", "C:\\tmp");
    values.put("lines", "a\nb");

    String json = JsonCodec.toJson(values);

    assertEquals("{\"quote\":\"say \\\"hi\\\"\",\"path\":\"C:\\\\tmp\",\"lines\":\"a\\nb\"}", json);
    assertEquals(values, JsonCodec.parseObject(json));
  }

  @Test
  void nullValuesAreSkipped() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("a", null);
    values.put("b", "1");

    assertEquals("{\"b\":\"1\"}", JsonCodec.toJson(values));
    assertEquals(Map.of("b", "1"), JsonCodec.parseObject("{\"a\": null, \"b\": \"1\"}"));
  }

  @Test
  void parsesWhitespaceAndUnicodeEscapes() {
    assertEquals(Map.of("k", "é"), JsonCodec.parseObject("  { \"k\" : \"\\u00e9\" }  "));
    assertTrue(JsonCodec.parseObject("{}").isEmpty());
    assertTrue(JsonCodec.parseObject("null").isEmpty());
    assertTrue(JsonCodec.parseObject(" ").isEmpty());
  }

  @Test
  void rejectsNonStringValuesAndMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> JsonCodec.parseObject("{\"n\": 1}"));
    assertThrows(IllegalArgumentException.class, () -> JsonCodec.parseObject("[\"a\"]"));
    assertThrows(IllegalArgumentException.class, () -> JsonCodec.parseObject("{\"a\":\"b\""));
    assertThrows(IllegalArgumentException.class, () -> JsonCodec.parseObject("{\"a\":\"b\"} x"));
  }
}
