package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.validation.ReferenceGraph;
import io.intellixity.strata.validation.ReferenceGraphProvider;

import static io.intellixity.strata.layer.CanonicalLayers.*;

/**
 * Module-level references of the geometric entity types.\n
 *
 * Back references (Scheme -> Spec, Morphism -> Homset, Divisor -> DivisorGroup) are deferred and so are absent.\n
 */
public final class GeometryReferenceGraphProvider implements ReferenceGraphProvider {
  @Override
  public String name() {
    return "geometry";
  }

  @Override
  public ReferenceGraph eagerReferences() {
    return ReferenceGraph.builder()
        .declare(SCHEME)
        .declare(POINT)

        .eager(SPEC, SCHEME)
        .eager(AMBIENT_SPACE, SCHEME)
        .eager(MORPHISM, SCHEME, POINT)

        .eager(TORIC_MORPHISM, MORPHISM, SCHEME)
        .eager(GLUE, MORPHISM, SCHEME)

        .eager(HOMSET, MORPHISM, SCHEME, SPEC)

        .eager(AFFINE_SCHEME, AMBIENT_SPACE, SPEC, MORPHISM, HOMSET)
        .eager(PROJECTIVE_SCHEME, AMBIENT_SPACE, MORPHISM, HOMSET)
        .eager(TORIC_VARIETY, AMBIENT_SPACE, TORIC_MORPHISM, HOMSET)

        .eager(ALGEBRAIC_SCHEME, AFFINE_SCHEME, PROJECTIVE_SCHEME, HOMSET)
        .eager(FANO_TORIC_VARIETY, TORIC_VARIETY)

        .eager(HYPERSURFACE, ALGEBRAIC_SCHEME, AFFINE_SCHEME, PROJECTIVE_SCHEME)

        .eager(DIVISOR, SCHEME, POINT)
        .eager(DIVISOR_GROUP, DIVISOR, SCHEME)
        .eager(TORIC_DIVISOR, DIVISOR, DIVISOR_GROUP, TORIC_VARIETY)
        .build();
  }
}
