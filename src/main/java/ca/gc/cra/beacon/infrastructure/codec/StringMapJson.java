package ca.gc.cra.beacon.infrastructure.codec;

import ca.gc.cra.beacon.application.port.ProtocolException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams flat {@code String -> String} maps to and from JSON objects for the context and label fields.
 */
final class StringMapJson {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Serializes a map; empty maps yield {@code null} so the field is encoded as absent.
   */
  byte[] write(Map<String, String> map) throws ProtocolException {
    if (map == null || map.isEmpty()) {
      return null;
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream(64 + map.size() * 32);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      for (Map.Entry<String, String> entry : map.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          throw new ProtocolException(
              "map field entries must have a key and a value (key " + entry.getKey() + ")");
        }
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new ProtocolException("Unable to serialize map field", ex);
    }
    return out.toByteArray();
  }

  Map<String, String> read(byte[] json) throws ProtocolException {
    if (json == null || json.length == 0) {
      return Map.of();
    }
    Map<String, String> map = new LinkedHashMap<>();
    try (JsonParser parser = factory.createParser(json)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new ProtocolException("map field must be a JSON object");
      }
      while (true) {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.END_OBJECT) {
          break;
        }
        if (token != JsonToken.FIELD_NAME) {
          throw new ProtocolException("Expected field name but found " + token);
        }
        String key = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (value != JsonToken.VALUE_STRING) {
          throw new ProtocolException("map value for '" + key + "' must be a string");
        }
        map.put(key, parser.getText());
      }
    } catch (IOException ex) {
      throw new ProtocolException("Invalid JSON map field", ex);
    }
    return map;
  }
}
