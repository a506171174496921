package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphrag.exception.StrategyValidationException;
import com.gentoro.graphrag.utility.JacksonUtility;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** Jackson tree helpers behind partial strategy updates. */
final class StrategyTrees {
  private StrategyTrees() {}

  /**
   * Deep, key-wise merge of {@code patch} into a copy of {@code base}. Objects merge recursively;
   * any other value (scalar, list, null) replaces the existing one.
   */
  static ObjectNode deepMerge(ObjectNode base, JsonNode patch) {
    ObjectNode result = base.deepCopy();
    mergeInto(result, patch);
    return result;
  }

  private static void mergeInto(ObjectNode target, JsonNode patch) {
    Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> e = fields.next();
      JsonNode existing = target.get(e.getKey());
      if (existing instanceof ObjectNode existingObject && e.getValue().isObject()) {
        mergeInto(existingObject, e.getValue());
      } else {
        target.set(e.getKey(), e.getValue().deepCopy());
      }
    }
  }

  static <T> T merge(T current, Map<String, ?> partial, Class<T> type) {
    ObjectMapper mapper = JacksonUtility.getStrictMapper();
    JsonNode patch = mapper.valueToTree(partial == null ? Map.of() : partial);
    if (!patch.isObject()) {
      throw new StrategyValidationException(
          "Partial strategy update must be an object", List.of("root must be an object"));
    }
    ObjectNode merged = deepMerge(mapper.valueToTree(current), patch);
    return read(merged, type);
  }

  static <T> T read(JsonNode tree, Class<T> type) {
    try {
      return JacksonUtility.getStrictMapper().treeToValue(tree, type);
    } catch (UnrecognizedPropertyException e) {
      String path =
          e.getPath().stream()
              .map(JsonMappingException.Reference::getFieldName)
              .filter(Objects::nonNull)
              .collect(Collectors.joining("."));
      throw new StrategyValidationException(
          "Unknown strategy key '%s'".formatted(path),
          List.of("unknown key '%s'".formatted(path)));
    } catch (JsonProcessingException e) {
      throw new StrategyValidationException(
          "Malformed strategy value: " + e.getOriginalMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new StrategyValidationException("Malformed strategy value: " + e.getMessage(), e);
    }
  }
}
