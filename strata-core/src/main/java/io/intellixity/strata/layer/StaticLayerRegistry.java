package io.intellixity.strata.layer;

import java.util.*;

/**
 * Immutable {@link LayerRegistry} backed by a fixed table.\n
 *
 * {@link #canonical()} is the process-wide registry of the geometric entity types; it is built once during class
 * initialization and never mutated. {@link #of(Map)} builds ad-hoc tables for tooling and tests.\n
 */
public final class StaticLayerRegistry implements LayerRegistry {
  private static final StaticLayerRegistry CANONICAL = new StaticLayerRegistry(CanonicalLayers.table());

  private final Map<String, EntityType> byName;
  private final List<EntityType> ordered;
  private final List<Layer> layers;

  private StaticLayerRegistry(Map<String, Integer> table) {
    Objects.requireNonNull(table, "table");
    Map<String, EntityType> names = new LinkedHashMap<>();
    SortedMap<Integer, List<String>> rows = new TreeMap<>();

    for (Map.Entry<String, Integer> e : table.entrySet()) {
      if (e.getKey() == null) throw new IllegalArgumentException("entity type name is null");
      if (e.getValue() == null) throw new IllegalArgumentException("layer is null for " + e.getKey());
      EntityType et = new EntityType(e.getKey().trim(), e.getValue());
      if (names.putIfAbsent(et.name(), et) != null) {
        throw new IllegalArgumentException("Duplicate entity type: " + et.name());
      }
      rows.computeIfAbsent(et.layer(), k -> new ArrayList<>()).add(et.name());
    }

    List<Layer> ls = new ArrayList<>(rows.size());
    List<EntityType> all = new ArrayList<>(names.size());
    for (Map.Entry<Integer, List<String>> row : rows.entrySet()) {
      ls.add(new Layer(row.getKey(), row.getValue()));
      for (String n : row.getValue()) all.add(names.get(n));
    }

    this.byName = Collections.unmodifiableMap(names);
    this.ordered = List.copyOf(all);
    this.layers = List.copyOf(ls);
  }

  /** The registry of the canonical geometric layer table. */
  public static StaticLayerRegistry canonical() {
    return CANONICAL;
  }

  public static StaticLayerRegistry of(Map<String, Integer> table) {
    return new StaticLayerRegistry(table);
  }

  @Override
  public int layerOf(String entityTypeName) {
    return entityType(entityTypeName).layer();
  }

  @Override
  public List<Layer> allLayers() {
    return layers;
  }

  @Override
  public boolean contains(String entityTypeName) {
    return entityTypeName != null && byName.containsKey(entityTypeName);
  }

  @Override
  public EntityType entityType(String entityTypeName) {
    if (entityTypeName == null || entityTypeName.isBlank()) throw new UnknownTypeException(entityTypeName);
    EntityType et = byName.get(entityTypeName);
    if (et == null) throw new UnknownTypeException(entityTypeName);
    return et;
  }

  @Override
  public List<EntityType> entityTypes() {
    return ordered;
  }

  @Override
  public String toString() {
    return "StaticLayerRegistry" + layers;
  }
}
