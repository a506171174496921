package com.gentoro.graphrag.retrieval.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.graphrag.exception.LlmException;
import com.gentoro.graphrag.llm.LlmClient;
import com.gentoro.graphrag.prompt.PromptTemplate;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.schema.SchemaDescriptor;
import com.gentoro.graphrag.utility.JacksonUtility;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Asks the language model to decompose the question and parses its JSON answer. Any failure
 * (model error, empty answer, malformed JSON) falls back to the given analyzer.
 */
public class LlmIntentAnalyzer implements IntentAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.graphrag.logging.LoggingService.getLogger(LlmIntentAnalyzer.class);

  public static final String PROMPT_ID = "intent-analysis";
  static final String SECTION_INSTRUCTIONS = "instructions";
  static final String SECTION_REQUEST = "request";

  private final LlmClient client;
  private final PromptTemplate template;
  private final SchemaDescriptor schema;
  private final IntentAnalyzer fallback;

  public LlmIntentAnalyzer(
      LlmClient client, PromptTemplate template, SchemaDescriptor schema, IntentAnalyzer fallback) {
    this.client = Objects.requireNonNull(client, "client");
    this.template = Objects.requireNonNull(template, "template");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  @Override
  public QueryIntent analyze(String question) {
    try {
      Map<String, Object> vars =
          Map.of(
              "question", question == null ? "" : question,
              "entity_types", new ArrayList<>(schema.entityTypes()),
              "relationship_types", new ArrayList<>(schema.relationshipTypes()));
      List<LlmClient.Message> messages =
          template
              .newSession()
              .enable(SECTION_INSTRUCTIONS, vars)
              .enable(SECTION_REQUEST, vars)
              .renderMessages();
      String answer = client.chat(messages);
      QueryIntent intent = parse(answer);
      log.debug("Intent from model: {}", intent);
      return intent.withQuestion(question);
    } catch (RuntimeException e) {
      log.warn("Intent analysis by model failed, using fallback analyzer: {}", e.getMessage());
      return fallback.analyze(question);
    }
  }

  /** Extracts the JSON object from a model answer, tolerating code fences and a "json" prefix. */
  static QueryIntent parse(String answer) {
    if (answer == null || answer.isBlank()) {
      throw new LlmException("Model returned an empty answer");
    }
    String json = StringUtility.extractSnippet(answer, "json");
    if (json == null) json = StringUtility.extractSnippet(answer, "");
    if (json == null) json = answer.trim();
    if (json.regionMatches(true, 0, "json", 0, 4)) json = json.substring(4).trim();
    try {
      QueryIntent intent = JacksonUtility.getJsonMapper().readValue(json, QueryIntent.class);
      if (intent == null) {
        throw new LlmException("Model answer is not a JSON object");
      }
      return intent;
    } catch (JsonProcessingException e) {
      throw new LlmException("Model answer is not valid intent JSON", e);
    }
  }
}
