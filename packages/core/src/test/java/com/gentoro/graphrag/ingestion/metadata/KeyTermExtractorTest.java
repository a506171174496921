package com.gentoro.graphrag.ingestion.metadata;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.strategy.KeyTermMethod;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KeyTermExtractorTest {

  @Test
  @DisplayName("quoted defined terms are found")
  void definedTerms() {
    assertEquals(
        List.of("Service Period"),
        KeyTermExtractor.definedTerms("during the \"Service Period\" only"));
  }

  @Test
  @DisplayName("simple method fills up with the most frequent words")
  void frequency() {
    KeyTermExtractor extractor = new KeyTermExtractor(KeyTermMethod.SIMPLE, 3);
    List<String> terms =
        extractor.extract("Payment of the fees. The supplier invoices fees monthly. fees are due.");
    assertEquals(List.of("fees", "Payment", "supplier"), terms);
  }

  @Test
  @DisplayName("regex method returns defined terms only")
  void regexOnly() {
    KeyTermExtractor extractor = new KeyTermExtractor(KeyTermMethod.REGEX, 5);
    assertEquals(
        List.of("Confidential Information"),
        extractor.extract("All \"Confidential Information\" stays secret; secret secret."));
  }

  @Test
  @DisplayName("never returns more than the configured maximum")
  void cap() {
    KeyTermExtractor extractor = new KeyTermExtractor(KeyTermMethod.SIMPLE, 2);
    assertEquals(2, extractor.extract("alpha beta gamma delta alpha beta gamma").size());
    assertTrue(extractor.extract("").isEmpty());
  }
}
