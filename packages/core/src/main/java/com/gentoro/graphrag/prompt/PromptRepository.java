package com.gentoro.graphrag.prompt;

/** Source of prompt templates addressed by id. */
public interface PromptRepository {
  /**
   * @throws com.gentoro.graphrag.exception.NotFoundException when no template has that id
   */
  PromptTemplate get(String id);
}
