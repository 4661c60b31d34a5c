package io.intellixity.strata.check;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Parsed command line of {@link LayeringCheckMain}. */
record CheckOptions(Format format, Path graphFile, boolean listLayers) {
  enum Format { TEXT, JSON }

  static CheckOptions parse(String[] args) {
    Format format = Format.TEXT;
    Path graph = null;
    boolean layers = false;

    for (String a : args) {
      if (a == null || a.isBlank()) continue;
      if (a.startsWith("--format=")) {
        String v = a.substring("--format=".length()).trim();
        if ("text".equalsIgnoreCase(v)) format = Format.TEXT;
        else if ("json".equalsIgnoreCase(v)) format = Format.JSON;
        else throw new IllegalArgumentException("Unknown format: " + v);
      } else if (a.startsWith("--graph=")) {
        String v = a.substring("--graph=".length()).trim();
        if (v.isEmpty()) throw new IllegalArgumentException("--graph requires a path");
        graph = Paths.get(v);
      } else if ("--layers".equals(a)) {
        layers = true;
      } else {
        throw new IllegalArgumentException("Unknown argument: " + a);
      }
    }
    return new CheckOptions(format, graph, layers);
  }
}
