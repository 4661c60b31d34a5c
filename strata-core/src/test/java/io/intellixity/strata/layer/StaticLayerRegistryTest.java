package io.intellixity.strata.layer;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.strata.layer.CanonicalLayers.*;
import static org.junit.jupiter.api.Assertions.*;

final class StaticLayerRegistryTest {

  @Test
  void canonical_assignsEveryTableEntry() {
    LayerRegistry r = StaticLayerRegistry.canonical();

    assertEquals(1, r.layerOf(SCHEME));
    assertEquals(1, r.layerOf(POINT));
    assertEquals(2, r.layerOf(SPEC));
    assertEquals(2, r.layerOf(AMBIENT_SPACE));
    assertEquals(2, r.layerOf(MORPHISM));
    assertEquals(3, r.layerOf(TORIC_MORPHISM));
    assertEquals(3, r.layerOf(GLUE));
    assertEquals(4, r.layerOf(HOMSET));
    assertEquals(5, r.layerOf(AFFINE_SCHEME));
    assertEquals(5, r.layerOf(PROJECTIVE_SCHEME));
    assertEquals(5, r.layerOf(TORIC_VARIETY));
    assertEquals(6, r.layerOf(ALGEBRAIC_SCHEME));
    assertEquals(6, r.layerOf(FANO_TORIC_VARIETY));
    assertEquals(7, r.layerOf(HYPERSURFACE));
    assertEquals(8, r.layerOf(DIVISOR));
    assertEquals(9, r.layerOf(DIVISOR_GROUP));
    assertEquals(10, r.layerOf(TORIC_DIVISOR));
    assertEquals(17, r.entityTypes().size());
  }

  @Test
  void canonical_isASingleInstance() {
    assertSame(StaticLayerRegistry.canonical(), StaticLayerRegistry.canonical());
  }

  @Test
  void allLayers_ascendingWithTableOrderWithinLayer() {
    List<Layer> layers = StaticLayerRegistry.canonical().allLayers();

    assertEquals(HIGHEST - LOWEST + 1, layers.size());
    assertEquals(LOWEST, layers.get(0).number());
    assertEquals(HIGHEST, layers.get(layers.size() - 1).number());
    for (int i = 0; i < layers.size(); i++) {
      assertEquals(LOWEST + i, layers.get(i).number());
    }
    assertEquals(List.of(SCHEME, POINT), layers.get(0).entityTypes());
    assertEquals(List.of(SPEC, AMBIENT_SPACE, MORPHISM), layers.get(1).entityTypes());
    assertEquals(List.of(AFFINE_SCHEME, PROJECTIVE_SCHEME, TORIC_VARIETY), layers.get(4).entityTypes());
    assertEquals(List.of(TORIC_DIVISOR), layers.get(9).entityTypes());
  }

  @Test
  void layerOf_unknownName_throws() {
    LayerRegistry r = StaticLayerRegistry.canonical();

    UnknownTypeException ex = assertThrows(UnknownTypeException.class, () -> r.layerOf("Sheaf"));
    assertEquals("Sheaf", ex.typeName());
    assertTrue(ex.getMessage().contains("Sheaf"));
    assertThrows(UnknownTypeException.class, () -> r.layerOf(null));
    assertThrows(UnknownTypeException.class, () -> r.layerOf(" "));
    assertThrows(UnknownTypeException.class, () -> r.layerOf("scheme"));
  }

  @Test
  void contains_isCaseSensitiveAndNullSafe() {
    LayerRegistry r = StaticLayerRegistry.canonical();
    assertTrue(r.contains(HOMSET));
    assertFalse(r.contains("homset"));
    assertFalse(r.contains(null));
  }

  @Test
  void exposedViews_areImmutable() {
    LayerRegistry r = StaticLayerRegistry.canonical();
    assertThrows(UnsupportedOperationException.class, () -> r.allLayers().clear());
    assertThrows(UnsupportedOperationException.class, () -> r.allLayers().get(0).entityTypes().add("Sheaf"));
    assertThrows(UnsupportedOperationException.class, () -> r.entityTypes().remove(0));
  }

  @Test
  void of_skipsEmptyLayersAndSortsRows() {
    Map<String, Integer> t = new LinkedHashMap<>();
    t.put("C", 7);
    t.put("A", 1);
    t.put("B", 7);

    StaticLayerRegistry r = StaticLayerRegistry.of(t);

    assertEquals(2, r.allLayers().size());
    assertEquals(new Layer(1, List.of("A")), r.allLayers().get(0));
    assertEquals(new Layer(7, List.of("C", "B")), r.allLayers().get(1));
    assertEquals(List.of(new EntityType("A", 1), new EntityType("C", 7), new EntityType("B", 7)), r.entityTypes());
  }

  @Test
  void of_rejectsMalformedTables() {
    assertThrows(IllegalArgumentException.class, () -> StaticLayerRegistry.of(Map.of("A", 0)));
    assertThrows(IllegalArgumentException.class, () -> StaticLayerRegistry.of(Map.of(" ", 1)));

    Map<String, Integer> dup = new LinkedHashMap<>();
    dup.put("A", 1);
    dup.put("A ", 2);
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> StaticLayerRegistry.of(dup));
    assertTrue(ex.getMessage().contains("Duplicate entity type: A"));
  }

  @Test
  void mayEagerlyReference_isStrict() {
    EntityType scheme = new EntityType(SCHEME, 1);
    EntityType point = new EntityType(POINT, 1);
    EntityType spec = new EntityType(SPEC, 2);

    assertTrue(spec.mayEagerlyReference(scheme));
    assertFalse(scheme.mayEagerlyReference(spec));
    assertFalse(scheme.mayEagerlyReference(point));
    assertFalse(scheme.mayEagerlyReference(scheme));
  }
}
