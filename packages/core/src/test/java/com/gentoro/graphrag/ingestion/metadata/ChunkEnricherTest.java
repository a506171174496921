package com.gentoro.graphrag.ingestion.metadata;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.ingestion.ChunkInput;
import com.gentoro.graphrag.strategy.ExtractionStrategy;
import com.gentoro.graphrag.strategy.PresetRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkEnricher")
class ChunkEnricherTest {

  private static PresetRegistry presets;

  @BeforeAll
  static void loadPresets() {
    presets = PresetRegistry.fromClasspath(PresetRegistry.DEFAULT_RESOURCE);
  }

  private static ExtractionStrategy extraction(String preset) {
    return presets.get(preset).extraction();
  }

  @Test
  @DisplayName("chunk ids are derived from document id and index")
  void chunkIds() {
    assertEquals("doc_chunk_3", ChunkEnricher.chunkId("doc", 3));
  }

  @Test
  @DisplayName("balanced preset computes headings, references, terms and counts")
  void balancedMetadata() {
    List<ChunkRecord> out =
        new ChunkEnricher(extraction("balanced"))
            .enrich(
                "doc",
                List.of(
                    ChunkInput.of(0, "ARTICLE 1 Term\nThis Agreement runs for two years.", 1),
                    ChunkInput.of(1, "The fee is due on March 1, 2024.", 2)));

    ChunkRecord first = out.get(0);
    assertEquals("doc_chunk_0", first.id());
    assertEquals("ARTICLE 1 Term", first.sectionHeading());
    assertEquals(Integer.valueOf(1), first.pageNumber());
    assertTrue(first.temporalRefs().contains("two years"));
    assertNotNull(first.keyTerms());
    assertEquals(Integer.valueOf(9), first.wordCount());
    assertNull(first.sentenceCount());

    ChunkRecord second = out.get(1);
    assertEquals("ARTICLE 1 Term", second.sectionHeading(), "heading carries forward");
    assertEquals(List.of("March 1, 2024"), second.temporalRefs());
    assertEquals(Integer.valueOf(32), second.charCount());
  }

  @Test
  @DisplayName("upstream metadata wins over computed values")
  void upstreamWins() {
    ChunkInput in =
        new ChunkInput(
            0, "ARTICLE 9 Other\nby May 5, 2025", 4, "Preamble", List.of("x"), List.of("y"));
    ChunkRecord out = new ChunkEnricher(extraction("balanced")).enrich("d", List.of(in)).get(0);
    assertEquals("Preamble", out.sectionHeading());
    assertEquals(List.of("x"), out.temporalRefs());
    assertEquals(List.of("y"), out.keyTerms());
  }

  @Test
  @DisplayName("speed preset leaves disabled metadata empty and truncates text")
  void speedPreset() {
    String longText = "word ".repeat(600);
    ChunkRecord out =
        new ChunkEnricher(extraction("speed"))
            .enrich("d", List.of(ChunkInput.of(0, longText)))
            .get(0);
    assertNull(out.sectionHeading());
    assertNull(out.temporalRefs());
    assertNull(out.keyTerms());
    assertNull(out.charCount());
    assertEquals(Integer.valueOf(600), out.wordCount());
    assertEquals(2000, out.text().length());
  }
}
