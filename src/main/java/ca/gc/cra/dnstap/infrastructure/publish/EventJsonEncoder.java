package ca.gc.cra.dnstap.infrastructure.publish;

import ca.gc.cra.dnstap.domain.event.DnsEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes {@link DnsEvent}s as compact JSON objects with fields in emission order.
 *
 * <p>Thread-safe; the underlying {@link JsonFactory} is shared and generators are per call.</p>
 *
 * @since 0.1.0
 */
public final class EventJsonEncoder {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Encodes an event as UTF-8 JSON.
   *
   * @param event event to encode; must not be {@code null}
   * @return JSON bytes
   */
  public byte[] encode(DnsEvent event) {
    Objects.requireNonNull(event, "event");
    ByteArrayOutputStream out = new ByteArrayOutputStream(512);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      for (Map.Entry<String, Object> field : event.fields().entrySet()) {
        writeField(gen, field.getKey(), field.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      // ByteArrayOutputStream never fails; a generator error here is a programming fault.
      throw new UncheckedIOException("Failed to encode DNS event", ex);
    }
    return out.toByteArray();
  }

  /**
   * Encodes an event as a JSON string.
   *
   * @param event event to encode; must not be {@code null}
   * @return JSON text
   */
  public String encodeToString(DnsEvent event) {
    return new String(encode(event), StandardCharsets.UTF_8);
  }

  private static void writeField(JsonGenerator gen, String name, Object value) throws IOException {
    if (value instanceof String s) {
      gen.writeStringField(name, s);
    } else if (value instanceof Integer i) {
      gen.writeNumberField(name, i);
    } else if (value instanceof Long l) {
      gen.writeNumberField(name, l);
    } else if (value instanceof Boolean b) {
      gen.writeBooleanField(name, b);
    } else {
      throw new IllegalArgumentException("Unsupported value type for field " + name + ": "
          + (value == null ? "null" : value.getClass().getName()));
    }
  }
}
