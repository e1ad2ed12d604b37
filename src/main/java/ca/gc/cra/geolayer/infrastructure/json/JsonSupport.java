package ca.gc.cra.geolayer.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams JSON documents into plain {@link Map}/{@link List} trees.
 *
 * <p>Objects keep field order; numbers keep Jackson's natural type ({@code Integer}, {@code Long},
 * {@code Double}, ...).</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a JSON string.
   *
   * @param json document text
   * @return parsed tree; empty map for an empty document
   * @throws IllegalArgumentException when the document is malformed
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON file.
   *
   * @param file document path
   * @return parsed tree; empty map for an empty document
   * @throws IOException when the file cannot be read or is malformed
   */
  public Object parse(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file);
        JsonParser parser = factory.createParser(in)) {
      return readDocument(parser);
    }
  }

  /**
   * Casts a parsed value to an object node.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return object node
   * @throws IOException when the value is not an object
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> requireObject(Object value, String what) throws IOException {
    if (value instanceof Map<?, ?>) {
      return (Map<String, Object>) value;
    }
    throw new IOException(what + " must be a JSON object");
  }

  /**
   * Casts a parsed value to an array node.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return array node
   * @throws IOException when the value is not an array
   */
  @SuppressWarnings("unchecked")
  public static List<Object> requireArray(Object value, String what) throws IOException {
    if (value instanceof List<?>) {
      return (List<Object>) value;
    }
    throw new IOException(what + " must be a JSON array");
  }

  private Object readDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return Map.of();
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IOException("JSON document contains trailing content");
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
