package com.gentoro.graphrag.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured reading of a question: what it asks for and which graph features it points at.
 * Every collection is non-null; {@code searchText}, {@code documentId} and {@code question} may be
 * {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
  "intent",
  "entity_types",
  "keywords",
  "filters",
  "temporal_hints",
  "search_text",
  "relationship_types",
  "document_id",
  "question"
})
public record QueryIntent(
    @JsonProperty("intent") String intent,
    @JsonProperty("entity_types") List<String> entityTypes,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("filters") Map<String, String> filters,
    @JsonProperty("temporal_hints") List<String> temporalHints,
    @JsonProperty("search_text") String searchText,
    @JsonProperty("relationship_types") List<String> relationshipTypes,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("question") String question) {

  public static final String GENERAL = "general";

  public QueryIntent {
    intent = intent == null || intent.isBlank() ? GENERAL : intent;
    entityTypes = cleaned(entityTypes);
    keywords = cleaned(keywords);
    filters = filters == null ? Map.of() : cleanedFilters(filters);
    temporalHints = cleaned(temporalHints);
    relationshipTypes = cleaned(relationshipTypes);
    searchText = searchText == null || searchText.isBlank() ? null : searchText.trim();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasSearchText() {
    return searchText != null;
  }

  public QueryIntent withQuestion(String question) {
    return new QueryIntent(
        intent,
        entityTypes,
        keywords,
        filters,
        temporalHints,
        searchText,
        relationshipTypes,
        documentId,
        question);
  }

  public QueryIntent withDocumentId(String documentId) {
    return new QueryIntent(
        intent,
        entityTypes,
        keywords,
        filters,
        temporalHints,
        searchText,
        relationshipTypes,
        documentId,
        question);
  }

  private static List<String> cleaned(List<String> values) {
    if (values == null) return List.of();
    List<String> out = new ArrayList<>();
    for (String v : values) {
      if (v != null && !v.isBlank() && !out.contains(v.trim())) out.add(v.trim());
    }
    return List.copyOf(out);
  }

  private static Map<String, String> cleanedFilters(Map<String, String> filters) {
    Map<String, String> out = new LinkedHashMap<>();
    filters.forEach(
        (k, v) -> {
          if (k != null && v != null && !v.isBlank()) out.put(k, v);
        });
    return Collections.unmodifiableMap(out);
  }

  public static final class Builder {
    private String intent;
    private final List<String> entityTypes = new ArrayList<>();
    private final List<String> keywords = new ArrayList<>();
    private final Map<String, String> filters = new LinkedHashMap<>();
    private final List<String> temporalHints = new ArrayList<>();
    private String searchText;
    private final List<String> relationshipTypes = new ArrayList<>();
    private String documentId;
    private String question;

    private Builder() {}

    public Builder intent(String intent) {
      this.intent = intent;
      return this;
    }

    public Builder entityTypes(String... types) {
      entityTypes.addAll(List.of(types));
      return this;
    }

    public Builder keywords(String... values) {
      keywords.addAll(List.of(values));
      return this;
    }

    public Builder filter(String property, String value) {
      filters.put(Objects.requireNonNull(property, "property"), value);
      return this;
    }

    public Builder temporalHints(String... hints) {
      temporalHints.addAll(List.of(hints));
      return this;
    }

    public Builder searchText(String searchText) {
      this.searchText = searchText;
      return this;
    }

    public Builder relationshipTypes(String... types) {
      relationshipTypes.addAll(List.of(types));
      return this;
    }

    public Builder documentId(String documentId) {
      this.documentId = documentId;
      return this;
    }

    public Builder question(String question) {
      this.question = question;
      return this;
    }

    public QueryIntent build() {
      return new QueryIntent(
          intent,
          entityTypes,
          keywords,
          filters,
          temporalHints,
          searchText,
          relationshipTypes,
          documentId,
          question);
    }
  }
}
