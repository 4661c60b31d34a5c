package io.intellixity.strata.layer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fixed load order of the geometric entity types.\n
 *
 * Layer 1 loads first. A type may eagerly reference only types of a strictly lower layer; anything else goes
 * through a deferred reference.\n
 */
public final class CanonicalLayers {
  private CanonicalLayers() {}

  public static final String SCHEME = "Scheme";
  public static final String POINT = "Point";
  public static final String SPEC = "Spec";
  public static final String AMBIENT_SPACE = "AmbientSpace";
  public static final String MORPHISM = "Morphism";
  public static final String TORIC_MORPHISM = "ToricMorphism";
  public static final String GLUE = "Glue";
  public static final String HOMSET = "Homset";
  public static final String AFFINE_SCHEME = "AffineScheme";
  public static final String PROJECTIVE_SCHEME = "ProjectiveScheme";
  public static final String TORIC_VARIETY = "ToricVariety";
  public static final String ALGEBRAIC_SCHEME = "AlgebraicScheme";
  public static final String FANO_TORIC_VARIETY = "FanoToricVariety";
  public static final String HYPERSURFACE = "Hypersurface";
  public static final String DIVISOR = "Divisor";
  public static final String DIVISOR_GROUP = "DivisorGroup";
  public static final String TORIC_DIVISOR = "ToricDivisor";

  public static final int LOWEST = 1;
  public static final int HIGHEST = 10;

  /** Entity type name -> layer, in table order. */
  static Map<String, Integer> table() {
    Map<String, Integer> t = new LinkedHashMap<>();
    t.put(SCHEME, 1);
    t.put(POINT, 1);

    t.put(SPEC, 2);
    t.put(AMBIENT_SPACE, 2);
    t.put(MORPHISM, 2);

    t.put(TORIC_MORPHISM, 3);
    t.put(GLUE, 3);

    t.put(HOMSET, 4);

    t.put(AFFINE_SCHEME, 5);
    t.put(PROJECTIVE_SCHEME, 5);
    t.put(TORIC_VARIETY, 5);

    t.put(ALGEBRAIC_SCHEME, 6);
    t.put(FANO_TORIC_VARIETY, 6);

    t.put(HYPERSURFACE, 7);
    t.put(DIVISOR, 8);
    t.put(DIVISOR_GROUP, 9);
    t.put(TORIC_DIVISOR, 10);
    return t;
  }
}
