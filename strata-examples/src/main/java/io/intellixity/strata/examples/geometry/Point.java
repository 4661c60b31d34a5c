package io.intellixity.strata.examples.geometry;

import java.util.List;
import java.util.Objects;

/** Layer 1. Coordinates only; the owning scheme shares the layer and so is never referenced. */
public record Point(List<String> coordinates) {
  public Point {
    coordinates = List.copyOf(Objects.requireNonNull(coordinates, "coordinates"));
  }

  public int dimension() {
    return coordinates.size();
  }
}
