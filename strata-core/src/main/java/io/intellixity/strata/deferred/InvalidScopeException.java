package io.intellixity.strata.deferred;

/** Raised when a deferred reference is declared at module scope, which would reintroduce load-time coupling. */
public final class InvalidScopeException extends RuntimeException {
  private final ReferenceScope scope;

  public InvalidScopeException(String fromType, String toType, ReferenceScope scope) {
    super("Deferred reference " + fromType + " -> " + toType + " must be declared in METHOD or CALL scope, got: "
        + scope);
    this.scope = scope;
  }

  public ReferenceScope scope() {
    return scope;
  }
}
