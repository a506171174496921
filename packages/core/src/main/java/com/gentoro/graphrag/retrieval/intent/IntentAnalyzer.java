package com.gentoro.graphrag.retrieval.intent;

import com.gentoro.graphrag.retrieval.QueryIntent;

/** Turns a natural-language question into a {@link QueryIntent}. */
public interface IntentAnalyzer {

  /** The returned intent carries {@code question} unchanged. Never returns {@code null}. */
  QueryIntent analyze(String question);
}
