package com.gentoro.graphrag.retrieval.intent;

import static com.gentoro.graphrag.testing.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import com.gentoro.graphrag.exception.LlmException;
import com.gentoro.graphrag.llm.LlmClient;
import com.gentoro.graphrag.prompt.impl.ClasspathPromptRepository;
import com.gentoro.graphrag.retrieval.QueryIntent;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LlmIntentAnalyzerTest {

  private static final String QUESTION = "Which party supplies the software?";

  @Mock private LlmClient client;
  @Captor private ArgumentCaptor<List<LlmClient.Message>> messages;

  private LlmIntentAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    analyzer =
        new LlmIntentAnalyzer(
            client,
            new ClasspathPromptRepository(ClasspathPromptRepository.DEFAULT_BASE_PATH)
                .get(LlmIntentAnalyzer.PROMPT_ID),
            schema(),
            new HeuristicIntentAnalyzer(schema()));
  }

  @Test
  @DisplayName("Parses a fenced JSON answer and keeps the question")
  void fencedAnswer() {
    when(client.chat(anyList()))
        .thenReturn(
            """
            Here is the decomposition:
            ```json
            {"intent": "find supplier", "entity_types": ["Party"],
             "filters": {"role": "supplier"}, "search_text": "software"}
            ```
            """);

    QueryIntent intent = analyzer.analyze(QUESTION);

    assertEquals("find supplier", intent.intent());
    assertEquals(List.of("Party"), intent.entityTypes());
    assertEquals(Map.of("role", "supplier"), intent.filters());
    assertEquals("software", intent.searchText());
    assertEquals(QUESTION, intent.question());
  }

  @Test
  @DisplayName("Sends the schema vocabulary and the question")
  void promptContent() {
    when(client.chat(anyList())).thenReturn("{\"intent\": \"x\"}");

    analyzer.analyze(QUESTION);

    verify(client).chat(messages.capture());
    List<LlmClient.Message> sent = messages.getValue();
    assertEquals(2, sent.size());
    assertEquals(LlmClient.Role.SYSTEM, sent.get(0).role());
    assertTrue(sent.get(0).content().contains("Entity types: Contract, Party, Obligation"));
    assertTrue(sent.get(0).content().contains("Relationship types: PARTY_TO, HAS_OBLIGATION"));
    assertEquals(LlmClient.Role.USER, sent.get(1).role());
    assertTrue(sent.get(1).content().contains("Question: " + QUESTION));
  }

  @Test
  @DisplayName("Tolerates a bare json prefix")
  void jsonPrefix() {
    QueryIntent intent = LlmIntentAnalyzer.parse("json {\"keywords\": [\"invoice\"]}");

    assertEquals(List.of("invoice"), intent.keywords());
    assertEquals(QueryIntent.GENERAL, intent.intent());
  }

  @Test
  @DisplayName("Rejects empty and malformed answers")
  void badAnswers() {
    assertThrows(LlmException.class, () -> LlmIntentAnalyzer.parse("  "));
    assertThrows(LlmException.class, () -> LlmIntentAnalyzer.parse("I cannot help with that"));
  }

  @Test
  @DisplayName("Falls back to the heuristic analyzer when the model fails")
  void fallbackOnError() {
    when(client.chat(anyList())).thenThrow(new LlmException("provider unavailable"));

    QueryIntent intent = analyzer.analyze(QUESTION);

    assertEquals(List.of("Party"), intent.entityTypes());
    assertEquals("entity_lookup", intent.intent());
    assertEquals(QUESTION, intent.question());
  }

  @Test
  @DisplayName("Falls back when the answer is not JSON")
  void fallbackOnGarbage() {
    when(client.chat(anyList())).thenReturn("The supplier is Acme.");

    QueryIntent intent = analyzer.analyze(QUESTION);

    assertEquals(new HeuristicIntentAnalyzer(schema()).analyze(QUESTION), intent);
  }
}
