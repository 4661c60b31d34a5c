package io.intellixity.strata.validation;

import io.intellixity.strata.layer.EntityType;
import io.intellixity.strata.layer.LayerRegistry;
import io.intellixity.strata.layer.StaticLayerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Build/test-time check of a {@link ReferenceGraph} against a {@link LayerRegistry}.\n
 *
 * Validates:\n
 * - every declaring and referenced type is registered (else {@link io.intellixity.strata.layer.UnknownTypeException})\n
 * - every eager reference A -> B has layerOf(B) &lt; layerOf(A); same-layer and self references are violations\n
 *
 * All violations are collected into one {@link ValidationReport}. Stateless; safe to run repeatedly and
 * concurrently.\n
 */
public final class DependencyValidator {
  private static final Logger log = LoggerFactory.getLogger(DependencyValidator.class);

  private final LayerRegistry registry;

  public DependencyValidator() {
    this(StaticLayerRegistry.canonical());
  }

  public DependencyValidator(LayerRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public ValidationReport validate(ReferenceGraph graph) {
    Objects.requireNonNull(graph, "graph");

    List<LayerViolation> violations = new ArrayList<>();
    int checked = 0;
    for (String fromName : graph.entityTypes()) {
      EntityType from = registry.entityType(fromName);
      for (String toName : graph.eagerReferences(fromName)) {
        EntityType to = registry.entityType(toName);
        checked++;
        if (!from.mayEagerlyReference(to)) {
          violations.add(new LayerViolation(from.name(), to.name(), from.layer(), to.layer()));
        }
      }
    }

    ValidationReport report = ValidationReport.of(violations);
    if (log.isDebugEnabled()) {
      log.debug("strata.validate types={} references={} violations={}",
          graph.entityTypes().size(), checked, report.size());
    }
    return report;
  }

  /** Validate and throw {@link LayerViolationException} unless the graph is clean. */
  public void requireValid(ReferenceGraph graph) {
    validate(graph).orThrow();
  }
}
