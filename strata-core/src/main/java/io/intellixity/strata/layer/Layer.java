package io.intellixity.strata.layer;

import java.util.List;
import java.util.Objects;

/** One row of the layer table: the layer number and the entity type names it holds, in table order. */
public record Layer(int number, List<String> entityTypes) {
  public Layer {
    if (number < 1) throw new IllegalArgumentException("layer number must be >= 1: " + number);
    entityTypes = List.copyOf(Objects.requireNonNull(entityTypes, "entityTypes"));
  }
}
