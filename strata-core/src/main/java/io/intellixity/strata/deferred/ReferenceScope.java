package io.intellixity.strata.deferred;

/** Where a reference is declared. Only call-scoped kinds may hold a deferred reference. */
public enum ReferenceScope {
  /** Type-definition time: static fields, initializers, imports. Never allowed for deferred references. */
  MODULE,
  /** Inside a method body of the referencing type. */
  METHOD,
  /** Inside a single call site, e.g. a lambda passed to another operation. */
  CALL;

  public boolean isCallScoped() {
    return this != MODULE;
  }
}
