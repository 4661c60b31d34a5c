package io.intellixity.strata.validation;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Every layering violation found by one {@link DependencyValidator} run.\n
 *
 * Violations are unique and ordered by source layer, source type, target type, then target layer. Empty means valid.\n
 */
@JsonSerialize(using = ValidationReportJsonSerializer.class)
@JsonDeserialize(using = ValidationReportJsonDeserializer.class)
public final class ValidationReport {
  private static final ValidationReport EMPTY = new ValidationReport(List.of());

  private final List<LayerViolation> violations;

  private ValidationReport(List<LayerViolation> violations) {
    this.violations = List.copyOf(violations);
  }

  public static ValidationReport empty() {
    return EMPTY;
  }

  public static ValidationReport of(Collection<LayerViolation> violations) {
    Objects.requireNonNull(violations, "violations");
    if (violations.isEmpty()) return EMPTY;
    TreeSet<LayerViolation> sorted = new TreeSet<>(LayerViolation.ORDER);
    sorted.addAll(violations);
    return new ValidationReport(new ArrayList<>(sorted));
  }

  public List<LayerViolation> violations() {
    return violations;
  }

  public boolean isEmpty() {
    return violations.isEmpty();
  }

  public int size() {
    return violations.size();
  }

  public List<String> lines() {
    List<String> out = new ArrayList<>(violations.size());
    for (LayerViolation v : violations) out.add(v.line());
    return out;
  }

  /** Returns this report when it is empty; otherwise throws {@link LayerViolationException} carrying it. */
  public ValidationReport orThrow() {
    if (!isEmpty()) throw new LayerViolationException(this);
    return this;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ValidationReport r && violations.equals(r.violations));
  }

  @Override
  public int hashCode() {
    return violations.hashCode();
  }

  @Override
  public String toString() {
    return isEmpty() ? "ValidationReport[ok]" : "ValidationReport" + lines();
  }
}
