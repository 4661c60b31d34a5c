package io.intellixity.strata.examples.geometry;

import java.util.Map;
import java.util.Objects;

/** Layer 10. A torus-invariant divisor; sits above its group, so it names it directly. */
public final class ToricDivisor extends Divisor {
  private final DivisorGroup group;

  public ToricDivisor(DivisorGroup group, Map<String, Integer> rayCoefficients) {
    super(Objects.requireNonNull(group, "group").scheme(), rayCoefficients);
    this.group = group;
  }

  public DivisorGroup group() {
    return group;
  }

  @Override
  public Group parent() {
    return group;
  }
}
