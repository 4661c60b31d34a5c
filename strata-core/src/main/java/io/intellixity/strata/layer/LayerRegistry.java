package io.intellixity.strata.layer;

import java.util.List;

/**
 * Read-only lookup of entity type layers.\n
 *
 * Implementations are immutable once constructed; concurrent readers need no locking.\n
 */
public interface LayerRegistry {
  /** Layer of the named type; throws {@link UnknownTypeException} when absent. */
  int layerOf(String entityTypeName);

  /** All layers ascending by number. Layers with no entity type are omitted. */
  List<Layer> allLayers();

  boolean contains(String entityTypeName);

  /** Entity type by name; throws {@link UnknownTypeException} when absent. */
  EntityType entityType(String entityTypeName);

  /** All entity types ascending by layer, table order within a layer. */
  List<EntityType> entityTypes();
}
