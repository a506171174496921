package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.exception.ExceptionUtil;
import com.gentoro.graphrag.exception.UnknownPresetException;
import com.gentoro.graphrag.utility.JacksonUtility;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named, fully validated strategy pairs. Presets are read once from a YAML resource of the form:
 *
 * <pre>
 * presets:
 *   balanced:
 *     extraction: { ... }
 *     retrieval: { ... }
 * </pre>
 *
 * Registry order follows the resource.
 */
public final class PresetRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(PresetRegistry.class);
  public static final String DEFAULT_RESOURCE = "strategies/presets.yaml";

  private final Map<String, StrategyPair> presets;

  public PresetRegistry(Map<String, StrategyPair> presets) {
    Objects.requireNonNull(presets, "presets");
    Map<String, StrategyPair> copy = new LinkedHashMap<>();
    presets.forEach((name, pair) -> copy.put(name, StrategyValidator.validate(pair)));
    this.presets = Collections.unmodifiableMap(copy);
  }

  public static PresetRegistry fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Preset resource not found on classpath: " + resource);
      }
      JsonNode root = JacksonUtility.getYamlMapper().readTree(in);
      JsonNode section = root.path("presets");
      if (!section.isObject() || section.isEmpty()) {
        throw new ConfigException("Preset resource '%s' has no 'presets' map".formatted(resource));
      }
      Map<String, StrategyPair> parsed = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = section.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        parsed.put(e.getKey(), StrategyTrees.read(e.getValue(), StrategyPair.class));
      }
      log.info("Loaded {} strategy presets from {}", parsed.size(), resource);
      return new PresetRegistry(parsed);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ConfigException("Failed to load strategy presets: " + resource, ex));
    }
  }

  public StrategyPair get(String name) {
    StrategyPair pair = name == null ? null : presets.get(name);
    if (pair == null) {
      throw new UnknownPresetException(name, names());
    }
    return pair;
  }

  public boolean contains(String name) {
    return name != null && presets.containsKey(name);
  }

  public List<String> names() {
    return List.copyOf(presets.keySet());
  }

  public List<PresetInfo> list() {
    List<PresetInfo> out = new ArrayList<>();
    presets.forEach(
        (name, pair) ->
            out.add(
                new PresetInfo(
                    name, pair.extraction().description(), pair.retrieval().description())));
    return out;
  }
}
