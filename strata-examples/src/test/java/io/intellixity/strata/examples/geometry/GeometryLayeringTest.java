package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.layer.EntityType;
import io.intellixity.strata.layer.LayerRegistry;
import io.intellixity.strata.layer.StaticLayerRegistry;
import io.intellixity.strata.validation.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** Build gate: the geometric library's declared module-level references respect the load order. */
final class GeometryLayeringTest {
  private final LayerRegistry layers = StaticLayerRegistry.canonical();

  @Test
  void discoveredGraph_passesValidation() {
    DiscoveredReferenceGraph discovered = new DiscoveredReferenceGraph(getClass().getClassLoader());

    assertEquals(List.of("geometry"), discovered.providerNames());
    ValidationReport report = new DependencyValidator().validate(discovered.graph());
    assertTrue(report.isEmpty(), () -> String.join("\n", report.lines()));
  }

  @Test
  void everyCanonicalTypeIsDeclared() {
    ReferenceGraph g = new GeometryReferenceGraphProvider().eagerReferences();
    for (EntityType et : layers.entityTypes()) {
      assertTrue(g.entityTypes().contains(et.name()), "undeclared: " + et.name());
    }
    assertEquals(layers.entityTypes().size(), g.entityTypes().size());
  }

  @Test
  void everyEagerReferencePointsStrictlyDown() {
    for (EagerReference r : new GeometryReferenceGraphProvider().eagerReferences().references()) {
      assertTrue(layers.layerOf(r.toType()) < layers.layerOf(r.fromType()), r::toString);
    }
  }

  @Test
  void backReferencesAreNotEager() {
    ReferenceGraph g = new GeometryReferenceGraphProvider().eagerReferences();
    assertFalse(g.eagerReferences("Scheme").contains("Spec"));
    assertFalse(g.eagerReferences("Morphism").contains("Homset"));
    assertFalse(g.eagerReferences("Divisor").contains("DivisorGroup"));
    assertTrue(g.eagerReferences("ToricDivisor").contains("DivisorGroup"));
  }
}
