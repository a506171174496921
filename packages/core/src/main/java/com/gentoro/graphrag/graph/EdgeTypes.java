package com.gentoro.graphrag.graph;

import java.util.List;

/** Infrastructure edge types written by ingestion. Relationship types come from the schema. */
public final class EdgeTypes {
  public static final String NEXT_CHUNK = "NEXT_CHUNK";
  public static final String PREV_CHUNK = "PREV_CHUNK";
  public static final String FROM_DOCUMENT = "FROM_DOCUMENT";
  public static final String EXTRACTED_FROM = "EXTRACTED_FROM";

  public static final List<String> INFRASTRUCTURE =
      List.of(NEXT_CHUNK, PREV_CHUNK, FROM_DOCUMENT, EXTRACTED_FROM);

  private EdgeTypes() {}

  public static boolean isChain(String type) {
    return NEXT_CHUNK.equals(type) || PREV_CHUNK.equals(type);
  }
}
