package io.intellixity.strata.validation;

import io.intellixity.strata.util.StrataFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference graph assembled from every {@link ReferenceGraphProvider} registered in
 * {@code META-INF/strata.factories}.\n
 *
 * Providers are merged in discovery order; a type declared by several providers gets the union of their references.\n
 */
public final class DiscoveredReferenceGraph {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredReferenceGraph.class);

  private final List<String> providerNames;
  private final ReferenceGraph graph;

  public DiscoveredReferenceGraph() {
    this(StrataFactoriesLoader.load(ReferenceGraphProvider.class));
  }

  public DiscoveredReferenceGraph(ClassLoader cl) {
    this(StrataFactoriesLoader.load(ReferenceGraphProvider.class, cl));
  }

  DiscoveredReferenceGraph(List<ReferenceGraphProvider> providers) {
    List<String> names = new ArrayList<>();
    ReferenceGraph merged = ReferenceGraph.empty();
    for (ReferenceGraphProvider p : providers) {
      if (p == null) continue;
      ReferenceGraph g = p.eagerReferences();
      if (g == null) throw new IllegalStateException("ReferenceGraphProvider returned null: " + p.name());
      names.add(p.name());
      merged = merged.merge(g);
      if (log.isDebugEnabled()) {
        log.debug("strata.graph_provider name={} types={} references={}",
            p.name(), g.entityTypes().size(), g.references().size());
      }
    }
    this.providerNames = List.copyOf(names);
    this.graph = merged;
  }

  public ReferenceGraph graph() {
    return graph;
  }

  public List<String> providerNames() {
    return providerNames;
  }
}
