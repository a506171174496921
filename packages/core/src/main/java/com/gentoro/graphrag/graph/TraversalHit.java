package com.gentoro.graphrag.graph;

/** An entity reached by graph traversal and its hop distance from the nearest seed. */
public record TraversalHit(EntityRecord entity, int depth) {}
