package io.intellixity.strata.validation;

import java.util.Objects;

/**
 * Raised when a reference graph breaks the load order.
 * <p>
 * Carries the complete report so a single failed build lists every offending reference.
 */
public final class LayerViolationException extends RuntimeException {
  private final ValidationReport report;

  public LayerViolationException(ValidationReport report) {
    super(message(Objects.requireNonNull(report, "report")));
    this.report = report;
  }

  public ValidationReport report() {
    return report;
  }

  private static String message(ValidationReport report) {
    StringBuilder sb = new StringBuilder()
        .append(report.size())
        .append(report.size() == 1 ? " layering violation:" : " layering violations:");
    for (String line : report.lines()) sb.append("\n  ").append(line);
    return sb.toString();
  }
}
