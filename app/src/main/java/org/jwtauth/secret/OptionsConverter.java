package org.jwtauth.secret;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

// Converts option values given as typed objects, maps or JSON strings into an options type.
public final class OptionsConverter {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private OptionsConverter() {
  }

  public static <T> T convert(Object value, Class<T> type) {
    if (type.isInstance(value)) {
      return type.cast(value);
    }
    if (value instanceof String) {
      try {
        return MAPPER.readValue((String) value, type);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            "Unable to parse " + type.getSimpleName() + " from JSON: " + e.getOriginalMessage(), e);
      }
    }
    if (value instanceof Map) {
      return MAPPER.convertValue(value, type);
    }
    throw new IllegalArgumentException(
        "Unsupported value for " + type.getSimpleName() + ": " + value.getClass().getName());
  }
}
