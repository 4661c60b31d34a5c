package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.deferred.DeclaredReference;
import io.intellixity.strata.deferred.DeferredReference;
import io.intellixity.strata.deferred.ReferenceScope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemeTest {

  @Test
  void defaultBaseScheme_isSpecZZ() {
    Scheme x = new Scheme("X");

    Scheme base = x.baseScheme();

    assertInstanceOf(Spec.class, base);
    assertEquals("ZZ", ((Spec) base).ring());
    assertEquals("Spec(ZZ)", base.name());
    assertEquals(base, x.baseScheme());
    assertTrue(GeometryDeferreds.resolver().declaredReferences()
        .contains(new DeclaredReference("Scheme", "Spec", ReferenceScope.METHOD)));
  }

  @Test
  void defaultBaseScheme_resolvesOnceAndIsReused() {
    new Scheme("X").baseScheme();
    DeferredReference<Scheme.BaseFactory> ref = Scheme.DEFAULT_BASE.get();
    assertNotNull(ref);
    assertTrue(ref.isResolved());
    Scheme.BaseFactory factory = ref.get();

    new Scheme("Y").baseScheme();

    assertSame(ref, Scheme.DEFAULT_BASE.get());
    assertSame(factory, Scheme.DEFAULT_BASE.get().get());
  }

  @Test
  void explicitBaseScheme_isKept() {
    Spec q = new Spec("QQ");
    Scheme x = new Scheme("X", q);

    assertSame(q, x.baseScheme());
  }

  @Test
  void specOverZZ_isItsOwnBase() {
    Spec zz = new Spec("ZZ");
    assertSame(zz, zz.baseScheme());
    assertEquals(zz, new Spec("QQ").baseScheme());
  }

  @Test
  void point_copiesItsCoordinates() {
    List<String> coords = new ArrayList<>(List.of("0", "1"));
    Point p = new Point(coords);
    coords.add("2");

    assertEquals(2, p.dimension());
    assertThrows(UnsupportedOperationException.class, () -> p.coordinates().add("3"));
  }
}
