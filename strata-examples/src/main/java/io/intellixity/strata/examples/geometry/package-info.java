/**
 * Minimal geometric entity types wired by the load-order policy.
 * <p>
 * The classes carry no mathematics. Each one references lower-layer types directly and reaches equal or higher
 * layers only through call-scoped deferred references resolved by class name.
 */
package io.intellixity.strata.examples.geometry;
