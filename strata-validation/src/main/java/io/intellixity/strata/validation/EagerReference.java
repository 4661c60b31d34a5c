package io.intellixity.strata.validation;

import java.util.Objects;

/** A load-time reference from one entity type to another. */
public record EagerReference(String fromType, String toType) {
  public EagerReference {
    Objects.requireNonNull(fromType, "fromType");
    Objects.requireNonNull(toType, "toType");
  }

  @Override
  public String toString() {
    return fromType + " -> " + toType;
  }
}
