package io.intellixity.strata.deferred;

/** Stands in for a higher-layer unit reached only through a deferred reference. */
public final class ReferencedUnit {
  static {
    UnitProbe.INITIALIZED.add("ReferencedUnit");
  }

  public ReferencedUnit() {}
}
