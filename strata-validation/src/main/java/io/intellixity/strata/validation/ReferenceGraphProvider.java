package io.intellixity.strata.validation;

/**
 * Contributes the declared eager references of a library's entity types.\n
 *
 * Registered in {@code META-INF/strata.factories} and picked up by {@link DiscoveredReferenceGraph}.\n
 */
public interface ReferenceGraphProvider {
  /** Short name used in diagnostics. */
  default String name() {
    return getClass().getSimpleName();
  }

  ReferenceGraph eagerReferences();
}
