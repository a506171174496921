package com.gentoro.graphrag.ingestion.metadata;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.ingestion.ChunkInput;
import com.gentoro.graphrag.strategy.ExtractionStrategy;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns upstream chunks into {@link ChunkRecord}s carrying only the metadata the extraction
 * strategy enables. Values supplied upstream win; missing ones are computed. A chunk without its
 * own heading inherits the last heading seen in reading order.
 */
public final class ChunkEnricher {
  private final ExtractionStrategy strategy;
  private final SectionHeadingDetector headings;
  private final TemporalReferenceExtractor temporal;
  private final KeyTermExtractor keyTerms;

  public ChunkEnricher(ExtractionStrategy strategy) {
    this.strategy = strategy;
    ExtractionStrategy.Metadata md = strategy.metadata();
    this.headings = new SectionHeadingDetector(md.sectionHeadings().patterns());
    ExtractionStrategy.TemporalReferences tr = md.temporalReferences();
    this.temporal =
        new TemporalReferenceExtractor(
            tr.extractDates(), tr.extractDurations(), tr.extractRelative());
    this.keyTerms = new KeyTermExtractor(md.keyTerms().method(), md.keyTerms().maxTerms());
  }

  public static String chunkId(String documentId, int chunkIndex) {
    return documentId + "_chunk_" + chunkIndex;
  }

  /** Chunks must already be sorted by chunk_index. */
  public List<ChunkRecord> enrich(String documentId, List<ChunkInput> chunks) {
    ExtractionStrategy.Metadata md = strategy.metadata();
    ExtractionStrategy.ChunkStorage storage = strategy.chunks();
    List<ChunkRecord> out = new ArrayList<>(chunks.size());
    String currentSection = null;
    for (ChunkInput in : chunks) {
      String text = in.text();

      String section = null;
      if (md.sectionHeadings().enabled()) {
        String detected =
            in.sectionHeading() != null
                ? in.sectionHeading()
                : headings.detect(text).orElse(null);
        if (detected != null) currentSection = detected;
        section = currentSection;
      }

      List<String> refs = null;
      if (md.temporalReferences().enabled()) {
        refs = in.temporalRefs() != null ? in.temporalRefs() : temporal.extract(text);
      }

      List<String> terms = null;
      if (md.keyTerms().enabled()) {
        terms = in.keyTerms() != null ? in.keyTerms() : keyTerms.extract(text);
      }

      ExtractionStrategy.Statistics stats = md.statistics();
      out.add(
          new ChunkRecord(
              chunkId(documentId, in.chunkIndex()),
              documentId,
              in.chunkIndex(),
              storage.storeText() ? truncate(text, storage.maxTextLength()) : null,
              md.pageNumbers().enabled() ? in.pageNumber() : null,
              section,
              refs,
              terms,
              stats.wordCount() ? StringUtility.words(text).size() : null,
              stats.charCount() ? text.length() : null,
              stats.sentenceCount() ? StringUtility.countSentences(text) : null));
    }
    return out;
  }

  private static String truncate(String text, int maxLength) {
    return maxLength > 0 && text.length() > maxLength ? text.substring(0, maxLength) : text;
  }
}
