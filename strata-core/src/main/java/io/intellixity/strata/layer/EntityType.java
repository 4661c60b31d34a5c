package io.intellixity.strata.layer;

import java.util.Objects;

/**
 * One class of mathematical object as seen by the layering policy: a name and its load-order layer.\n
 *
 * Only the type is classified; instances are owned by the geometric library.\n
 */
public record EntityType(String name, int layer) {
  public EntityType {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("entity type name is blank");
    if (layer < 1) throw new IllegalArgumentException("layer must be >= 1: " + name + "=" + layer);
  }

  /** True when an eager reference from this type to {@code target} respects the load order. */
  public boolean mayEagerlyReference(EntityType target) {
    Objects.requireNonNull(target, "target");
    return target.layer < layer;
  }
}
