package io.b2mash.propertysync.schema;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Converts list-valued form fields to and from the single text column the backend stores them in.
 * Lists are written as JSON arrays; text input is already encoded and passes through unchanged.
 */
@Component
public class CollectionCodec {

  private static final Logger log = LoggerFactory.getLogger(CollectionCodec.class);
  private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public CollectionCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(Object value) {
    if (!ValueCoercion.isPresent(value)) {
      return null;
    }
    if (value instanceof String str) {
      return str;
    }
    if (value instanceof Collection<?> collection) {
      return objectMapper.writeValueAsString(new ArrayList<>(collection));
    }
    if (value.getClass().isArray()) {
      int length = Array.getLength(value);
      var items = new ArrayList<Object>(length);
      for (int i = 0; i < length; i++) {
        items.add(Array.get(value, i));
      }
      return objectMapper.writeValueAsString(items);
    }
    return value.toString();
  }

  /**
   * Decodes a stored collection. JSON arrays are parsed; anything else is treated as a
   * comma-separated list, the format older rows were written in.
   */
  public List<String> decode(Object stored) {
    if (!ValueCoercion.isPresent(stored)) {
      return List.of();
    }
    if (stored instanceof Collection<?> collection) {
      return collection.stream().map(String::valueOf).toList();
    }
    String text = stored.toString().trim();
    if (text.startsWith("[")) {
      var parsed = parseJsonArray(text);
      if (parsed.isPresent()) {
        return parsed.get();
      }
    }
    return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }

  private Optional<List<String>> parseJsonArray(String text) {
    try {
      return Optional.of(
          objectMapper.readValue(text, LIST_TYPE).stream().map(String::valueOf).toList());
    } catch (JacksonException e) {
      log.debug("Stored collection is not a JSON array, reading as comma-separated: {}", text);
      return Optional.empty();
    }
  }
}
