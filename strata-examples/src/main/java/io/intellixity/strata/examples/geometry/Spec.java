package io.intellixity.strata.examples.geometry;

import java.util.Objects;

/** Layer 2. The spectrum of a ring. */
public final class Spec extends Scheme {
  private final String ring;

  public Spec(String ring) {
    super("Spec(" + Objects.requireNonNull(ring, "ring") + ")");
    this.ring = ring;
  }

  public String ring() {
    return ring;
  }

  /** Spec(ZZ) is its own base; any other spectrum sits over Spec(ZZ). */
  @Override
  public Scheme baseScheme() {
    return BASE_RING.equals(ring) ? this : new Spec(BASE_RING);
  }

  /** Resolved by {@link Scheme#baseScheme()} through a deferred reference. */
  public static final class DefaultBase implements BaseFactory {
    public DefaultBase() {}

    @Override
    public Scheme over(String ring) {
      return new Spec(ring);
    }
  }
}
