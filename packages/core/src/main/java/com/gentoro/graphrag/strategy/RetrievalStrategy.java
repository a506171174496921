package com.gentoro.graphrag.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Controls how a question is answered from the graph: which signals run, how matched chunks are
 * expanded, how scores are weighted and how large the assembled context may grow.
 */
@JsonPropertyOrder({"name", "description", "search", "context", "scoring", "limits"})
public record RetrievalStrategy(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("search") Search search,
    @JsonProperty("context") Context context,
    @JsonProperty("scoring") Scoring scoring,
    @JsonProperty("limits") Limits limits) {

  public RetrievalStrategy {
    name = Objects.requireNonNullElse(name, "default");
    description = Objects.requireNonNullElse(description, "Default retrieval strategy");
    search = Objects.requireNonNullElseGet(search, () -> new Search(null, null, null, null));
    context = Objects.requireNonNullElseGet(context, () -> new Context(null, null));
    scoring =
        Objects.requireNonNullElseGet(
            scoring, () -> new Scoring(null, null, null, null, null, null));
    limits = Objects.requireNonNullElseGet(limits, () -> new Limits(null, null, null));
  }

  public static RetrievalStrategy defaults() {
    return new RetrievalStrategy(null, null, null, null, null, null);
  }

  public record Search(
      @JsonProperty("graph_traversal") GraphTraversal graphTraversal,
      @JsonProperty("chunk_text_search") ChunkTextSearch chunkTextSearch,
      @JsonProperty("keyword_matching") KeywordMatching keywordMatching,
      @JsonProperty("temporal_filtering") TemporalFiltering temporalFiltering) {
    public Search {
      graphTraversal =
          Objects.requireNonNullElseGet(graphTraversal, () -> new GraphTraversal(null, null));
      chunkTextSearch =
          Objects.requireNonNullElseGet(chunkTextSearch, () -> new ChunkTextSearch(null, null));
      keywordMatching =
          Objects.requireNonNullElseGet(keywordMatching, () -> new KeywordMatching(null, null));
      temporalFiltering =
          Objects.requireNonNullElseGet(temporalFiltering, () -> new TemporalFiltering(null, null));
    }
  }

  public record GraphTraversal(
      @JsonProperty("enabled") Boolean enabled, @JsonProperty("max_depth") Integer maxDepth) {
    public GraphTraversal {
      enabled = Objects.requireNonNullElse(enabled, true);
      maxDepth = Objects.requireNonNullElse(maxDepth, 2);
    }
  }

  public record ChunkTextSearch(
      @JsonProperty("enabled") Boolean enabled, @JsonProperty("method") TextSearchMethod method) {
    public ChunkTextSearch {
      enabled = Objects.requireNonNullElse(enabled, true);
      method = Objects.requireNonNullElse(method, TextSearchMethod.CONTAINS);
    }
  }

  public record KeywordMatching(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("match_threshold") Double matchThreshold) {
    public KeywordMatching {
      enabled = Objects.requireNonNullElse(enabled, true);
      matchThreshold = Objects.requireNonNullElse(matchThreshold, 0.5);
    }
  }

  public record TemporalFiltering(
      @JsonProperty("enabled") Boolean enabled, @JsonProperty("auto_detect") Boolean autoDetect) {
    public TemporalFiltering {
      enabled = Objects.requireNonNullElse(enabled, true);
      autoDetect = Objects.requireNonNullElse(autoDetect, true);
    }
  }

  public record Context(
      @JsonProperty("expand_neighbors") ExpandNeighbors expandNeighbors,
      @JsonProperty("include_metadata") IncludeMetadata includeMetadata) {
    public Context {
      expandNeighbors =
          Objects.requireNonNullElseGet(
              expandNeighbors, () -> new ExpandNeighbors(null, null, null));
      includeMetadata =
          Objects.requireNonNullElseGet(
              includeMetadata, () -> new IncludeMetadata(null, null, null, null));
    }
  }

  public record ExpandNeighbors(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("before") Integer before,
      @JsonProperty("after") Integer after) {
    public ExpandNeighbors {
      enabled = Objects.requireNonNullElse(enabled, true);
      before = Objects.requireNonNullElse(before, 1);
      after = Objects.requireNonNullElse(after, 1);
    }
  }

  public record IncludeMetadata(
      @JsonProperty("section_heading") Boolean sectionHeading,
      @JsonProperty("page_number") Boolean pageNumber,
      @JsonProperty("temporal_refs") Boolean temporalRefs,
      @JsonProperty("key_terms") Boolean keyTerms) {
    public IncludeMetadata {
      sectionHeading = Objects.requireNonNullElse(sectionHeading, true);
      pageNumber = Objects.requireNonNullElse(pageNumber, true);
      temporalRefs = Objects.requireNonNullElse(temporalRefs, true);
      keyTerms = Objects.requireNonNullElse(keyTerms, false);
    }
  }

  public record Scoring(
      @JsonProperty("entity_confidence_min") Double entityConfidenceMin,
      @JsonProperty("graph_match_weight") Double graphMatchWeight,
      @JsonProperty("text_match_weight") Double textMatchWeight,
      @JsonProperty("keyword_match_weight") Double keywordMatchWeight,
      @JsonProperty("temporal_match_weight") Double temporalMatchWeight,
      @JsonProperty("recency_boost") Boolean recencyBoost) {
    public Scoring {
      entityConfidenceMin = Objects.requireNonNullElse(entityConfidenceMin, 0.5);
      graphMatchWeight = Objects.requireNonNullElse(graphMatchWeight, 1.5);
      textMatchWeight = Objects.requireNonNullElse(textMatchWeight, 1.0);
      keywordMatchWeight = Objects.requireNonNullElse(keywordMatchWeight, 1.0);
      temporalMatchWeight = Objects.requireNonNullElse(temporalMatchWeight, 0.5);
      recencyBoost = Objects.requireNonNullElse(recencyBoost, false);
    }
  }

  public record Limits(
      @JsonProperty("max_chunks") Integer maxChunks,
      @JsonProperty("max_entities") Integer maxEntities,
      @JsonProperty("max_context_tokens") Integer maxContextTokens) {
    public Limits {
      maxChunks = Objects.requireNonNullElse(maxChunks, 10);
      maxEntities = Objects.requireNonNullElse(maxEntities, 20);
      maxContextTokens = Objects.requireNonNullElse(maxContextTokens, 4000);
    }
  }
}
