package io.intellixity.strata.validation;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Immutable snapshot of declared eager (module-level) references between entity types.\n
 *
 * Deferred references are never part of the graph: they are not load-time dependencies.\n
 * JSON form: {@code {"Spec": ["Scheme"], "Scheme": []}}.\n
 */
@JsonSerialize(using = ReferenceGraphJsonSerializer.class)
@JsonDeserialize(using = ReferenceGraphJsonDeserializer.class)
public final class ReferenceGraph {
  private static final ReferenceGraph EMPTY = new ReferenceGraph(Map.of());

  private final Map<String, Set<String>> eager;

  private ReferenceGraph(Map<String, Set<String>> eager) {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Set<String>> e : eager.entrySet()) {
      copy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
    }
    this.eager = Collections.unmodifiableMap(copy);
  }

  public static ReferenceGraph empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Entity types that declare references (possibly none), in declaration order. */
  public Set<String> entityTypes() {
    return eager.keySet();
  }

  /** Eager references of {@code fromType}; empty when the type declares none. */
  public Set<String> eagerReferences(String fromType) {
    return eager.getOrDefault(fromType, Set.of());
  }

  public List<EagerReference> references() {
    List<EagerReference> out = new ArrayList<>();
    for (Map.Entry<String, Set<String>> e : eager.entrySet()) {
      for (String to : e.getValue()) out.add(new EagerReference(e.getKey(), to));
    }
    return out;
  }

  public boolean isEmpty() {
    return eager.isEmpty();
  }

  /** Union of both graphs' declarations and references. */
  public ReferenceGraph merge(ReferenceGraph other) {
    Objects.requireNonNull(other, "other");
    if (other.isEmpty()) return this;
    if (isEmpty()) return other;
    return builder().addAll(this).addAll(other).build();
  }

  Map<String, Set<String>> asMap() {
    return eager;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ReferenceGraph g && eager.equals(g.eager));
  }

  @Override
  public int hashCode() {
    return eager.hashCode();
  }

  @Override
  public String toString() {
    return "ReferenceGraph" + eager;
  }

  public static final class Builder {
    private final Map<String, Set<String>> eager = new LinkedHashMap<>();

    private Builder() {}

    /** Declare an entity type, with or without eager references. */
    public Builder declare(String entityType) {
      eager.computeIfAbsent(requireName(entityType, "entityType"), k -> new LinkedHashSet<>());
      return this;
    }

    public Builder eager(String fromType, String... toTypes) {
      Set<String> refs = eager.computeIfAbsent(requireName(fromType, "fromType"), k -> new LinkedHashSet<>());
      for (String to : toTypes) refs.add(requireName(to, "toType"));
      return this;
    }

    public Builder addAll(ReferenceGraph graph) {
      Objects.requireNonNull(graph, "graph");
      for (Map.Entry<String, Set<String>> e : graph.eager.entrySet()) {
        eager(e.getKey(), e.getValue().toArray(new String[0]));
      }
      return this;
    }

    public ReferenceGraph build() {
      return eager.isEmpty() ? EMPTY : new ReferenceGraph(eager);
    }

    private static String requireName(String name, String what) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException(what + " is blank");
      return name.trim();
    }
  }
}
