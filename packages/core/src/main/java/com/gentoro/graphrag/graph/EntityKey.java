package com.gentoro.graphrag.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Comparator;
import java.util.Objects;

/** Identity of an entity: unique within its type namespace. */
public record EntityKey(@JsonProperty("type") String type, @JsonProperty("id") String id)
    implements Comparable<EntityKey> {
  private static final Comparator<EntityKey> ORDER =
      Comparator.comparing(EntityKey::type).thenComparing(EntityKey::id);

  public EntityKey {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
  }

  public static EntityKey of(String type, String id) {
    return new EntityKey(type, id);
  }

  @Override
  public int compareTo(EntityKey o) {
    return ORDER.compare(this, o);
  }

  @Override
  public String toString() {
    return type + ":" + id;
  }
}
