package io.intellixity.strata.validation;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Canonical JSON deserializer for {@link ValidationReport}; {@code valid} and {@code violationCount} are derived. */
public final class ValidationReportJsonDeserializer extends JsonDeserializer<ValidationReport> {
  @Override
  public ValidationReport deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("ValidationReport JSON must be an object");

    JsonNode vs = root.get("violations");
    if (vs == null || vs.isNull()) return ValidationReport.empty();
    if (!vs.isArray()) throw new IllegalArgumentException("'violations' must be an array");

    List<LayerViolation> out = new ArrayList<>(vs.size());
    for (JsonNode v : vs) {
      out.add(new LayerViolation(
          requiredText(v, "fromType"),
          requiredText(v, "toType"),
          requiredInt(v, "fromLayer"),
          requiredInt(v, "toLayer")
      ));
    }
    return ValidationReport.of(out);
  }

  private static String requiredText(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || !v.isTextual()) throw new IllegalArgumentException("Violation requires string '" + field + "'");
    return v.asText();
  }

  private static int requiredInt(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || !v.isIntegralNumber() || !v.canConvertToInt()) throw new IllegalArgumentException("Violation requires int '" + field + "'");
    return v.asInt();
  }
}
