package notifier.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes flat {@code Map<String, String>} columns (job parameters, template data,
 * metadata) as JSON objects.
 *
 * <p>Only string values are supported. Nested objects, arrays and numbers are rejected
 * on read; {@code null} values are skipped.
 */
final class JsonCodec {

  private JsonCodec() {
  }

  /**
   * @return the JSON object, or {@code null} for a null or empty map
   */
  static String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("map cannot contain null keys");
      }
      if (entry.getValue() == null) {
        continue;
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      appendString(sb, entry.getKey());
      sb.append(':');
      appendString(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  /**
   * @return the parsed map; empty for {@code null}, blank or {@code "null"} input
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  static Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(json);
    in.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (in.peek() == '}') {
      in.next();
      in.expectEnd();
      return result;
    }
    while (true) {
      String key = in.string();
      in.expect(':');
      if (in.peek() == 'n') {
        in.literal("null");
      } else {
        result.put(key, in.string());
      }
      char c = in.next();
      if (c == '}') {
        in.expectEnd();
        return result;
      }
      if (c != ',') {
        throw new IllegalArgumentException("Expected ',' or '}' at " + (in.pos - 1));
      }
    }
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    private void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    private char peek() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(pos);
    }

    private char next() {
      char c = peek();
      pos++;
      return c;
    }

    private void expect(char expected) {
      char c = next();
      if (c != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + (pos - 1));
      }
    }

    private void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters at " + pos);
      }
    }

    private void literal(String word) {
      skipWhitespace();
      if (!input.startsWith(word, pos)) {
        throw new IllegalArgumentException("Expected string value at " + pos);
      }
      pos += word.length();
    }

    private String string() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          break;
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"':
          case '\\':
          case '/':
            sb.append(escaped);
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'u':
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
