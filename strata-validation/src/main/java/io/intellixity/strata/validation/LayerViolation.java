package io.intellixity.strata.validation;

import java.util.Comparator;
import java.util.Objects;

/** An eager reference whose target does not sit on a strictly lower layer than its source. */
public record LayerViolation(String fromType, String toType, int fromLayer, int toLayer) {
  static final Comparator<LayerViolation> ORDER = Comparator
      .comparingInt(LayerViolation::fromLayer)
      .thenComparing(LayerViolation::fromType)
      .thenComparing(LayerViolation::toType)
      .thenComparingInt(LayerViolation::toLayer);

  public LayerViolation {
    Objects.requireNonNull(fromType, "fromType");
    Objects.requireNonNull(toType, "toType");
  }

  public boolean sameLayer() {
    return fromLayer == toLayer;
  }

  /** One report line: offending type, target type and both layers. */
  public String line() {
    return fromType + " (layer " + fromLayer + ") -> " + toType + " (layer " + toLayer + ")";
  }
}
