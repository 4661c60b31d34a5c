package io.intellixity.strata.validation;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/** Canonical JSON serializer for {@link ReferenceGraph}. */
public final class ReferenceGraphJsonSerializer extends JsonSerializer<ReferenceGraph> {
  @Override
  public void serialize(ReferenceGraph graph, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (graph == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    for (Map.Entry<String, Set<String>> e : graph.asMap().entrySet()) {
      g.writeArrayFieldStart(e.getKey());
      for (String to : e.getValue()) g.writeString(to);
      g.writeEndArray();
    }
    g.writeEndObject();
  }
}
