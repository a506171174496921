package com.gentoro.graphrag.llm;

import java.util.List;

/**
 * Black-box access to a language model. The library never ships a provider; embedders plug in
 * their own client, and every caller has a non-LLM fallback when the client fails.
 */
public interface LlmClient {

  /**
   * Sends one conversation and returns the model's final text answer.
   *
   * @throws com.gentoro.graphrag.exception.LlmException when the provider cannot answer
   */
  String chat(List<Message> messages);

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {}
}
