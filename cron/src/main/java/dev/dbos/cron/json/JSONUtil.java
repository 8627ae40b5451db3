package dev.dbos.cron.json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JSONUtil {

  private static final ObjectMapper mapper = new ObjectMapper();

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

  public static class JsonRuntimeException extends RuntimeException {
    public JsonRuntimeException(JsonProcessingException cause) {
      super(cause.getMessage(), cause);
      setStackTrace(cause.getStackTrace());
      for (Throwable suppressed : cause.getSuppressed()) {
        addSuppressed(suppressed);
      }
    }
  }

  static {
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    // canonical output: object keys always in the same order
    mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
  }

  public static String toJson(Object obj) {
    try {
      return mapper.writeValueAsString(obj);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static <T> T fromJson(String content, Class<T> valueType) {
    try {
      return mapper.readValue(content, valueType);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static <T> T fromJson(String content, TypeReference<T> valueType) {
    try {
      return mapper.readValue(content, valueType);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static Map<String, Object> toMap(String json) {
    return json == null ? null : fromJson(json, MAP_TYPE);
  }

  public static List<String> toStringList(String json) {
    return json == null ? null : fromJson(json, STRING_LIST_TYPE);
  }

  /**
   * Serializes a participant list in its canonical form (sorted), so two lists holding the same
   * participants compare equal whatever their order.
   */
  public static String canonicalList(List<String> values) {
    if (values == null) {
      return null;
    }
    var sorted = new ArrayList<>(values);
    sorted.sort(null);
    return toJson(sorted);
  }
}
