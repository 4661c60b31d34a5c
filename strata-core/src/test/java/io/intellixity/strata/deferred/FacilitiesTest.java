package io.intellixity.strata.deferred;

import org.junit.jupiter.api.Test;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

final class FacilitiesTest {

  @Test
  void byClassName_instantiatesOnEveryCall() {
    Supplier<Object> s = Facilities.byClassName("java.lang.Object", Object.class);
    assertNotSame(s.get(), s.get());
  }

  @Test
  void byClassName_rejectsBlankNames() {
    assertThrows(IllegalArgumentException.class, () -> Facilities.byClassName(" ", Object.class));
    assertThrows(NullPointerException.class, () -> Facilities.byClassName(null, Object.class));
  }

  @Test
  void byClassName_failsOnlyWhenInvoked() {
    Supplier<Runnable> missing = Facilities.byClassName("com.acme.NoSuchSpec", Runnable.class);
    IllegalStateException ex = assertThrows(IllegalStateException.class, missing::get);
    assertTrue(ex.getMessage().contains("com.acme.NoSuchSpec"));

    Supplier<Runnable> wrongType = Facilities.byClassName("java.lang.Object", Runnable.class);
    assertThrows(IllegalArgumentException.class, wrongType::get);
  }
}
