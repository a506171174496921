package com.gentoro.graphrag.prompt;

import com.gentoro.graphrag.llm.LlmClient;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a prompt template composed of multiple sections. Use {@link
 * PromptSession} to select sections and render.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g. "intent-analysis"). */
  String id();

  List<PromptSection> sections();

  PromptSession newSession();

  /** A single prompt section (message) definition. */
  record PromptSection(LlmClient.Role role, String id, boolean enabledByDefault, String content) {}

  /** Per-render mutable state: which sections are enabled and with which variables. */
  interface PromptSession {
    PromptSession enable(String sectionId, Map<String, Object> vars);

    PromptSession disable(String... sectionIds);

    /** Reset the enabled state to the template defaults. */
    PromptSession resetToDefaults();

    List<LlmClient.Message> renderMessages();
  }
}
