package io.intellixity.strata.deferred;

import java.util.Objects;

/** A (from, to, scope) triple recorded by {@link DeferredReferenceResolver#declareDeferred}. */
public record DeclaredReference(String fromType, String toType, ReferenceScope scope) {
  public DeclaredReference {
    Objects.requireNonNull(fromType, "fromType");
    Objects.requireNonNull(toType, "toType");
    Objects.requireNonNull(scope, "scope");
  }

  @Override
  public String toString() {
    return fromType + " ~> " + toType + " (" + scope + ")";
  }
}
