package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Controls how documents are written into the graph: chunk storage, chunk linking, metadata
 * enrichment, entity provenance and schema validation.
 *
 * <p>Instances are immutable. Missing sub-trees fall back to their defaults, so a partial YAML or
 * JSON document always yields a complete strategy.
 */
@JsonPropertyOrder({
  "name",
  "description",
  "chunking",
  "chunks",
  "chunk_linking",
  "metadata",
  "entity_linking",
  "validation"
})
public record ExtractionStrategy(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("chunking") Chunking chunking,
    @JsonProperty("chunks") ChunkStorage chunks,
    @JsonProperty("chunk_linking") ChunkLinking chunkLinking,
    @JsonProperty("metadata") Metadata metadata,
    @JsonProperty("entity_linking") EntityLinking entityLinking,
    @JsonProperty("validation") Validation validation) {

  public ExtractionStrategy {
    name = Objects.requireNonNullElse(name, "default");
    description = Objects.requireNonNullElse(description, "Default extraction strategy");
    chunking = Objects.requireNonNullElseGet(chunking, () -> new Chunking(null, null, null));
    chunks = Objects.requireNonNullElseGet(chunks, () -> new ChunkStorage(null, null, null));
    chunkLinking = Objects.requireNonNullElseGet(chunkLinking, () -> new ChunkLinking(null, null));
    metadata =
        Objects.requireNonNullElseGet(metadata, () -> new Metadata(null, null, null, null, null));
    entityLinking =
        Objects.requireNonNullElseGet(entityLinking, () -> new EntityLinking(null, null, null));
    validation =
        Objects.requireNonNullElseGet(validation, () -> new Validation(null, null, null, null));
  }

  public static ExtractionStrategy defaults() {
    return new ExtractionStrategy(null, null, null, null, null, null, null, null);
  }

  public record Chunking(
      @JsonProperty("strategy") ChunkingMethod strategy,
      @JsonProperty("chunk_size") Integer chunkSize,
      @JsonProperty("chunk_overlap") Integer chunkOverlap) {
    public Chunking {
      strategy = Objects.requireNonNullElse(strategy, ChunkingMethod.FIXED);
      chunkSize = Objects.requireNonNullElse(chunkSize, 1000);
      chunkOverlap = Objects.requireNonNullElse(chunkOverlap, 200);
    }
  }

  public record ChunkStorage(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("store_text") Boolean storeText,
      @JsonProperty("max_text_length") Integer maxTextLength) {
    public ChunkStorage {
      enabled = Objects.requireNonNullElse(enabled, true);
      storeText = Objects.requireNonNullElse(storeText, true);
      maxTextLength = Objects.requireNonNullElse(maxTextLength, 0);
    }
  }

  public record ChunkLinking(
      @JsonProperty("sequential") Boolean sequential,
      @JsonProperty("to_document") Boolean toDocument) {
    public ChunkLinking {
      sequential = Objects.requireNonNullElse(sequential, true);
      toDocument = Objects.requireNonNullElse(toDocument, true);
    }
  }

  public record Metadata(
      @JsonProperty("page_numbers") Toggle pageNumbers,
      @JsonProperty("section_headings") SectionHeadings sectionHeadings,
      @JsonProperty("temporal_references") TemporalReferences temporalReferences,
      @JsonProperty("key_terms") KeyTerms keyTerms,
      @JsonProperty("statistics") Statistics statistics) {
    public Metadata {
      pageNumbers = Objects.requireNonNullElseGet(pageNumbers, () -> new Toggle(null));
      sectionHeadings =
          Objects.requireNonNullElseGet(sectionHeadings, () -> new SectionHeadings(null, null));
      temporalReferences =
          Objects.requireNonNullElseGet(
              temporalReferences, () -> new TemporalReferences(null, null, null, null));
      keyTerms = Objects.requireNonNullElseGet(keyTerms, () -> new KeyTerms(null, null, null));
      statistics =
          Objects.requireNonNullElseGet(statistics, () -> new Statistics(null, null, null));
    }
  }

  public record Toggle(@JsonProperty("enabled") Boolean enabled) {
    public Toggle {
      enabled = Objects.requireNonNullElse(enabled, true);
    }
  }

  public record SectionHeadings(
      @JsonProperty("enabled") Boolean enabled, @JsonProperty("patterns") List<String> patterns) {
    public static final List<String> DEFAULT_PATTERNS =
        List.of(
            "^(ARTICLE|Article|SECTION|Section)\\s+\\d+",
            "^\\d+\\.\\s+[A-Z]",
            "^[A-Z][A-Z\\s]{3,}$");

    public SectionHeadings {
      enabled = Objects.requireNonNullElse(enabled, true);
      patterns = patterns == null ? DEFAULT_PATTERNS : List.copyOf(patterns);
    }
  }

  public record TemporalReferences(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("extract_dates") Boolean extractDates,
      @JsonProperty("extract_durations") Boolean extractDurations,
      @JsonProperty("extract_relative") Boolean extractRelative) {
    public TemporalReferences {
      enabled = Objects.requireNonNullElse(enabled, true);
      extractDates = Objects.requireNonNullElse(extractDates, true);
      extractDurations = Objects.requireNonNullElse(extractDurations, true);
      extractRelative = Objects.requireNonNullElse(extractRelative, true);
    }
  }

  public record KeyTerms(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("method") KeyTermMethod method,
      @JsonProperty("max_terms") Integer maxTerms) {
    public KeyTerms {
      enabled = Objects.requireNonNullElse(enabled, true);
      method = Objects.requireNonNullElse(method, KeyTermMethod.SIMPLE);
      maxTerms = Objects.requireNonNullElse(maxTerms, 10);
    }
  }

  public record Statistics(
      @JsonProperty("word_count") Boolean wordCount,
      @JsonProperty("char_count") Boolean charCount,
      @JsonProperty("sentence_count") Boolean sentenceCount) {
    public Statistics {
      wordCount = Objects.requireNonNullElse(wordCount, true);
      charCount = Objects.requireNonNullElse(charCount, true);
      sentenceCount = Objects.requireNonNullElse(sentenceCount, false);
    }
  }

  public record EntityLinking(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("store_source_text") Boolean storeSourceText,
      @JsonProperty("store_chunk_index") Boolean storeChunkIndex) {
    public EntityLinking {
      enabled = Objects.requireNonNullElse(enabled, true);
      storeSourceText = Objects.requireNonNullElse(storeSourceText, false);
      storeChunkIndex = Objects.requireNonNullElse(storeChunkIndex, true);
    }
  }

  public record Validation(
      @JsonProperty("mode") ValidationMode mode,
      @JsonProperty("log_level") String logLevel,
      @JsonProperty("fail_on_missing_required") Boolean failOnMissingRequired,
      @JsonProperty("fail_on_broken_relationships") Boolean failOnBrokenRelationships) {
    public Validation {
      mode = Objects.requireNonNullElse(mode, ValidationMode.WARN);
      logLevel = Objects.requireNonNullElse(logLevel, "info");
      failOnMissingRequired = Objects.requireNonNullElse(failOnMissingRequired, false);
      failOnBrokenRelationships = Objects.requireNonNullElse(failOnBrokenRelationships, true);
    }
  }
}
