package com.gentoro.graphrag.retrieval;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders retrieved chunks, entities and relationships as markdown for the answer generator.
 * Output depends only on the arguments: chunks are laid out in document order, entities in rank
 * order grouped by type, relationships sorted.
 */
public class ContextFormatter {
  static final List<String> PRIORITY_FIELDS =
      List.of("name", "title", "description", "type", "value", "summary");

  private static final Comparator<ChunkRecord> DOCUMENT_ORDER =
      Comparator.comparing(ChunkRecord::documentId).thenComparingInt(ChunkRecord::chunkIndex);

  public String format(
      String query,
      List<EntityRecord> entities,
      List<ChunkRecord> chunks,
      Collection<RelationshipRecord> relationships,
      RetrievalStrategy.IncludeMetadata metadata) {
    List<String> parts = new ArrayList<>();
    parts.add("# Context for Query: " + (query == null ? "" : query) + "\n");

    if (!chunks.isEmpty()) {
      parts.add("\n## Document Excerpts\n");
      List<ChunkRecord> ordered = new ArrayList<>(chunks);
      ordered.sort(DOCUMENT_ORDER);
      String document = null;
      String section = null;
      Integer page = null;
      for (ChunkRecord chunk : ordered) {
        if (!chunk.documentId().equals(document)) {
          document = chunk.documentId();
          section = null;
          page = null;
        }
        if (metadata.sectionHeading()
            && chunk.sectionHeading() != null
            && !chunk.sectionHeading().equals(section)) {
          section = chunk.sectionHeading();
          parts.add("\n### " + section + "\n");
        }
        if (metadata.pageNumber()
            && chunk.pageNumber() != null
            && !chunk.pageNumber().equals(page)) {
          page = chunk.pageNumber();
          parts.add("\n[Page " + page + "]\n");
        }
        if (!chunk.textOrEmpty().isEmpty()) {
          parts.add(chunk.text() + "\n");
        }
        if (metadata.temporalRefs() && !chunk.temporalRefsOrEmpty().isEmpty()) {
          parts.add("_Temporal references: " + String.join(", ", chunk.temporalRefs()) + "_\n");
        }
        if (metadata.keyTerms() && !chunk.keyTermsOrEmpty().isEmpty()) {
          parts.add("_Key terms: " + String.join(", ", chunk.keyTerms()) + "_\n");
        }
      }
    }

    if (!entities.isEmpty()) {
      parts.add("\n## Extracted Information\n");
      Map<String, List<EntityRecord>> byType = new LinkedHashMap<>();
      for (EntityRecord e : entities) {
        byType.computeIfAbsent(e.type(), t -> new ArrayList<>()).add(e);
      }
      for (Map.Entry<String, List<EntityRecord>> group : byType.entrySet()) {
        parts.add("\n### " + group.getKey() + "s\n");
        for (EntityRecord e : group.getValue()) {
          parts.add(formatEntity(e));
        }
      }
    }

    List<String> lines = relationshipLines(entities, relationships);
    if (!lines.isEmpty()) {
      parts.add("\n## Relationships\n");
      parts.add(String.join("\n", lines) + "\n");
    }
    return String.join("\n", parts);
  }

  static String formatEntity(EntityRecord entity) {
    Map<String, Object> props = entity.properties();
    List<String> lines = new ArrayList<>();
    lines.add("**" + entity.displayName() + "**");
    for (String field : PRIORITY_FIELDS) {
      Object value = props.get(field);
      if (present(value)) {
        lines.add("  - " + field + ": " + value);
      }
    }
    // remaining scalar fields, alphabetical
    for (Map.Entry<String, Object> e : new TreeMap<>(props).entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      if (PRIORITY_FIELDS.contains(key) || key.startsWith("_") || !present(value)) continue;
      if (value instanceof Collection<?> || value instanceof Map<?, ?>) continue;
      lines.add("  - " + key + ": " + value);
    }
    return String.join("\n", lines) + "\n";
  }

  private static List<String> relationshipLines(
      List<EntityRecord> entities, Collection<RelationshipRecord> relationships) {
    Map<EntityKey, String> names = new LinkedHashMap<>();
    for (EntityRecord e : entities) {
      names.put(e.key(), e.displayName());
    }
    List<String> lines = new ArrayList<>();
    for (RelationshipRecord r : relationships) {
      String source = names.get(r.source());
      String target = names.get(r.target());
      if (source != null && target != null) {
        lines.add("- " + source + " --[" + r.type() + "]--> " + target);
      }
    }
    lines.sort(Comparator.naturalOrder());
    return lines.stream().distinct().toList();
  }

  private static boolean present(Object value) {
    return value != null && !(value instanceof String s && s.isBlank());
  }
}
