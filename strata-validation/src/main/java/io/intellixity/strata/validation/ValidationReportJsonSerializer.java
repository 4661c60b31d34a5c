package io.intellixity.strata.validation;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link ValidationReport}. */
public final class ValidationReportJsonSerializer extends JsonSerializer<ValidationReport> {
  @Override
  public void serialize(ValidationReport r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    g.writeBooleanField("valid", r.isEmpty());
    g.writeNumberField("violationCount", r.size());
    g.writeArrayFieldStart("violations");
    for (LayerViolation v : r.violations()) {
      g.writeStartObject();
      g.writeStringField("fromType", v.fromType());
      g.writeStringField("toType", v.toType());
      g.writeNumberField("fromLayer", v.fromLayer());
      g.writeNumberField("toLayer", v.toLayer());
      g.writeEndObject();
    }
    g.writeEndArray();
    g.writeEndObject();
  }
}
