package io.intellixity.strata.validation;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/** Canonical JSON deserializer for {@link ReferenceGraph}. */
public final class ReferenceGraphJsonDeserializer extends JsonDeserializer<ReferenceGraph> {
  @Override
  public ReferenceGraph deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("ReferenceGraph JSON must be an object");

    ReferenceGraph.Builder b = ReferenceGraph.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> f = fields.next();
      JsonNode refs = f.getValue();
      b.declare(f.getKey());
      if (refs == null || refs.isNull()) continue;
      if (!refs.isArray()) {
        throw new IllegalArgumentException("References of '" + f.getKey() + "' must be an array");
      }
      for (JsonNode to : refs) {
        if (!to.isTextual()) {
          throw new IllegalArgumentException("Reference of '" + f.getKey() + "' must be a string: " + to);
        }
        b.eager(f.getKey(), to.asText());
      }
    }
    return b.build();
  }
}
