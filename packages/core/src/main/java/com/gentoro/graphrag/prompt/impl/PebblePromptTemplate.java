package com.gentoro.graphrag.prompt.impl;

import com.gentoro.graphrag.exception.PromptException;
import com.gentoro.graphrag.llm.LlmClient;
import com.gentoro.graphrag.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Pebble-based implementation of an immutable PromptTemplate definition. Rendering state is
 * isolated in PromptSession instances.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<CompiledSection> compiled;

  private record CompiledSection(PromptSection section, PebbleTemplate template) {}

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    this.compiled =
        this.sections.stream()
            .map(s -> new CompiledSection(s, ENGINE.getLiteralTemplate(s.content())))
            .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public PromptSession newSession() {
    return new Session();
  }

  private class Session implements PromptSession {
    private final Map<String, Map<String, Object>> enabled = new HashMap<>();

    Session() {
      resetToDefaults();
    }

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      enabled.put(sectionId, vars != null ? new HashMap<>(vars) : new HashMap<>());
      return this;
    }

    @Override
    public PromptSession disable(String... sectionIds) {
      if (sectionIds != null) {
        for (String sectionId : sectionIds) {
          enabled.remove(sectionId);
        }
      }
      return this;
    }

    @Override
    public PromptSession resetToDefaults() {
      enabled.clear();
      for (PromptSection s : sections) {
        if (s.enabledByDefault()) {
          enable(s.id(), Map.of());
        }
      }
      return this;
    }

    @Override
    public List<LlmClient.Message> renderMessages() {
      List<LlmClient.Message> out = new ArrayList<>();
      for (CompiledSection cs : compiled) {
        PromptSection s = cs.section();
        if (!enabled.containsKey(s.id())) {
          continue;
        }
        try {
          Writer writer = new StringWriter();
          cs.template().evaluate(writer, enabled.get(s.id()));
          out.add(new LlmClient.Message(s.role(), writer.toString()));
        } catch (Exception e) {
          throw new PromptException(
              "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
        }
      }
      return out;
    }
  }
}
