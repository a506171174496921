package com.gentoro.graphrag.strategy;

import com.gentoro.graphrag.exception.ConfigException;
import com.gentoro.graphrag.exception.IoException;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the active extraction and retrieval strategies.
 *
 * <p>The store keeps a single {@link AtomicReference} to an immutable {@link StrategySnapshot}.
 * Readers take the reference once per request and work on that snapshot for the rest of the
 * request. Writers build a complete new snapshot and swap the reference, so a reader never sees a
 * partially applied update.
 */
public class StrategyStore {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(StrategyStore.class);

  private final PresetRegistry presets;
  private final String defaultPreset;
  private final AtomicReference<StrategySnapshot> current;

  public StrategyStore(PresetRegistry presets, String defaultPreset) {
    this.presets = Objects.requireNonNull(presets, "presets");
    if (!presets.contains(defaultPreset)) {
      throw new ConfigException(
          "Default preset '%s' is not registered; available: %s"
              .formatted(defaultPreset, presets.names()));
    }
    this.defaultPreset = defaultPreset;
    this.current =
        new AtomicReference<>(StrategySnapshot.of(presets.get(defaultPreset), defaultPreset));
  }

  /** Consistent snapshot of both strategies and the active preset name. */
  public StrategySnapshot get() {
    return current.get();
  }

  public StrategySnapshot loadPreset(String name) {
    StrategyPair pair = presets.get(name);
    StrategySnapshot next = StrategySnapshot.of(pair, name);
    current.set(next);
    log.info("Loaded strategy preset '{}'", name);
    return next;
  }

  /**
   * Deep-merges {@code partialTree} into the selected strategy. Keys absent from the partial tree
   * keep their current values. The active preset becomes {@code null} (custom).
   *
   * @return the full resulting snapshot
   */
  public StrategySnapshot update(StrategyKind kind, Map<String, ?> partialTree) {
    Objects.requireNonNull(kind, "kind");
    StrategySnapshot next =
        current.updateAndGet(
            snap ->
                switch (kind) {
                  case EXTRACTION -> new StrategySnapshot(
                      StrategyValidator.validate(
                          StrategyTrees.merge(
                              snap.extraction(), partialTree, ExtractionStrategy.class)),
                      snap.retrieval(),
                      null);
                  case RETRIEVAL -> new StrategySnapshot(
                      snap.extraction(),
                      StrategyValidator.validate(
                          StrategyTrees.merge(
                              snap.retrieval(), partialTree, RetrievalStrategy.class)),
                      null);
                });
    log.info("Updated {} strategy with keys {}", kind.name().toLowerCase(), keysOf(partialTree));
    return next;
  }

  /** Replace one strategy tree entirely. The active preset becomes {@code null}. */
  public StrategySnapshot replace(StrategyKind kind, Object strategy) {
    Objects.requireNonNull(kind, "kind");
    StrategySnapshot next =
        switch (kind) {
          case EXTRACTION -> {
            if (!(strategy instanceof ExtractionStrategy es)) {
              throw new ValidationException("Expected an ExtractionStrategy for kind EXTRACTION");
            }
            ExtractionStrategy valid = StrategyValidator.validate(es);
            yield current.updateAndGet(s -> new StrategySnapshot(valid, s.retrieval(), null));
          }
          case RETRIEVAL -> {
            if (!(strategy instanceof RetrievalStrategy rs)) {
              throw new ValidationException("Expected a RetrievalStrategy for kind RETRIEVAL");
            }
            RetrievalStrategy valid = StrategyValidator.validate(rs);
            yield current.updateAndGet(s -> new StrategySnapshot(s.extraction(), valid, null));
          }
        };
    log.info("Replaced {} strategy", kind.name().toLowerCase());
    return next;
  }

  /** Restore the default preset. */
  public StrategySnapshot reset() {
    log.info("Resetting strategies to default preset '{}'", defaultPreset);
    return loadPreset(defaultPreset);
  }

  public List<PresetInfo> listPresets() {
    return presets.list();
  }

  public StrategyStatus status() {
    StrategySnapshot snap = current.get();
    return new StrategyStatus(
        snap.activePreset(),
        snap.extraction().name(),
        snap.retrieval().name(),
        snap.extraction().validation().mode(),
        presets.names());
  }

  /** Write the current strategy pair as YAML. */
  public void exportTo(Path file) {
    try {
      Files.writeString(file, JacksonUtility.toYaml(current.get().pair()), StandardCharsets.UTF_8);
      log.info("Exported strategies to {}", file);
    } catch (IOException e) {
      throw new IoException("Failed to write strategies to " + file, e);
    }
  }

  /** Replace both strategies from a YAML file written by {@link #exportTo(Path)}. */
  public StrategySnapshot importFrom(Path file) {
    StrategyPair pair;
    try {
      pair =
          StrategyTrees.read(
              JacksonUtility.getYamlMapper().readTree(Files.readString(file)), StrategyPair.class);
    } catch (IOException e) {
      throw new IoException("Failed to read strategies from " + file, e);
    }
    StrategyValidator.validate(pair);
    StrategySnapshot next = StrategySnapshot.of(pair, null);
    current.set(next);
    log.info("Imported strategies from {}", file);
    return next;
  }

  private static Object keysOf(Map<String, ?> partial) {
    return partial == null ? List.of() : partial.keySet();
  }
}
