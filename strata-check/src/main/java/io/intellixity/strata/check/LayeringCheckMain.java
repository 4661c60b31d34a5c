package io.intellixity.strata.check;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.strata.layer.Layer;
import io.intellixity.strata.layer.LayerRegistry;
import io.intellixity.strata.layer.StaticLayerRegistry;
import io.intellixity.strata.layer.UnknownTypeException;
import io.intellixity.strata.validation.DependencyValidator;
import io.intellixity.strata.validation.DiscoveredReferenceGraph;
import io.intellixity.strata.validation.ReferenceGraph;
import io.intellixity.strata.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * CLI build gate:
 *   LayeringCheckMain [--format=text|json] [--graph=&lt;graph.json&gt;] [--layers]
 *
 * Validates the reference graph (from --graph, else discovered through META-INF/strata.factories) against the
 * canonical layer table.
 * Exit codes: 0 valid (no output in text mode), 1 violations or unknown types, 2 usage error or a graph that
 * cannot be read or discovered.
 */
public final class LayeringCheckMain {
  private static final Logger log = LoggerFactory.getLogger(LayeringCheckMain.class);

  static final int OK = 0;
  static final int VIOLATIONS = 1;
  static final int USAGE = 2;

  private static final String USAGE_LINE =
      "Usage: LayeringCheckMain [--format=text|json] [--graph=<graph.json>] [--layers]";

  private static final ObjectMapper JSON = new ObjectMapper();

  private LayeringCheckMain() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    CheckOptions opts;
    try {
      opts = CheckOptions.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE_LINE);
      return USAGE;
    }

    LayerRegistry registry = StaticLayerRegistry.canonical();
    if (opts.listLayers()) {
      for (Layer l : registry.allLayers()) {
        out.println(l.number() + ": " + String.join(", ", l.entityTypes()));
      }
      return OK;
    }

    ReferenceGraph graph;
    try {
      graph = loadGraph(opts);
    } catch (UncheckedIOException | IllegalArgumentException e) {
      err.println("Cannot read reference graph: " + e.getMessage());
      return USAGE;
    } catch (IllegalStateException e) {
      log.warn("strata.check discovery_failed", e);
      err.println("Cannot discover reference graph: " + e.getMessage());
      return USAGE;
    }

    ValidationReport report;
    try {
      report = new DependencyValidator(registry).validate(graph);
    } catch (UnknownTypeException e) {
      err.println(e.getMessage());
      return VIOLATIONS;
    }
    log.info("strata.check types={} references={} violations={}",
        graph.entityTypes().size(), graph.references().size(), report.size());

    if (opts.format() == CheckOptions.Format.JSON) {
      out.println(toJson(report));
    } else {
      for (String line : report.lines()) out.println(line);
    }
    return report.isEmpty() ? OK : VIOLATIONS;
  }

  private static ReferenceGraph loadGraph(CheckOptions opts) {
    if (opts.graphFile() == null) {
      DiscoveredReferenceGraph d = new DiscoveredReferenceGraph();
      if (d.providerNames().isEmpty()) log.warn("strata.check no ReferenceGraphProvider registered");
      return d.graph();
    }
    try {
      ReferenceGraph g = JSON.readValue(opts.graphFile().toFile(), ReferenceGraph.class);
      if (g == null) throw new IllegalArgumentException("empty document: " + opts.graphFile());
      return g;
    } catch (IOException e) {
      throw new UncheckedIOException(opts.graphFile().toString(), e);
    }
  }

  private static String toJson(ValidationReport report) {
    try {
      return JSON.writeValueAsString(report);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
