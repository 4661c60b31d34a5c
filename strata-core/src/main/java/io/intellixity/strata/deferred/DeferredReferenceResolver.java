package io.intellixity.strata.deferred;

import io.intellixity.strata.layer.EntityType;
import io.intellixity.strata.layer.LayerRegistry;
import io.intellixity.strata.layer.StaticLayerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Declares and resolves call-scoped deferred references between entity types.\n
 *
 * Semantics:\n
 * - declaration validates scope and both type names, nothing is loaded\n
 * - first resolution runs the resolution function; later ones reuse the cached result\n
 * - a resolution of A -> B that, while in flight on the same thread, triggers a resolution targeting A fails with
 *   {@link IllegalStateException}: the load-time cycle came back through B's initialization\n
 */
public final class DeferredReferenceResolver {
  private static final Logger log = LoggerFactory.getLogger(DeferredReferenceResolver.class);

  // Per-thread stack of resolutions in progress; cycles can only recurse on the resolving thread.
  private static final ThreadLocal<Deque<DeferredReference<?>>> IN_FLIGHT = ThreadLocal.withInitial(ArrayDeque::new);

  private final LayerRegistry registry;
  private final Set<DeclaredReference> declared = ConcurrentHashMap.newKeySet();

  public DeferredReferenceResolver() {
    this(StaticLayerRegistry.canonical());
  }

  public DeferredReferenceResolver(LayerRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public <T> DeferredReference<T> declareDeferred(String fromType,
                                                  String toType,
                                                  ReferenceScope scope,
                                                  Supplier<? extends T> resolution) {
    if (scope == null || !scope.isCallScoped()) throw new InvalidScopeException(fromType, toType, scope);
    Objects.requireNonNull(resolution, "resolution");
    EntityType from = registry.entityType(fromType);
    EntityType to = registry.entityType(toType);

    if (from.mayEagerlyReference(to) && log.isDebugEnabled()) {
      log.debug("strata.deferred_optional from={} fromLayer={} to={} toLayer={} (an eager reference would be valid)",
          from.name(), from.layer(), to.name(), to.layer());
    }

    DeclaredReference d = new DeclaredReference(from.name(), to.name(), scope);
    declared.add(d);
    return new DeferredReference<>(this, d, resolution);
  }

  public <T> T resolve(DeferredReference<T> ref) {
    Objects.requireNonNull(ref, "ref");
    T cached = ref.cached();
    if (cached != null) return cached;

    Deque<DeferredReference<?>> inFlight = IN_FLIGHT.get();
    for (DeferredReference<?> r : inFlight) {
      if (r == ref || r.fromType().equals(ref.toType())) {
        throw new IllegalStateException("Deferred resolution cycle: " + describe(inFlight, ref));
      }
    }

    long t0 = System.nanoTime();
    T value;
    inFlight.push(ref);
    try {
      value = ref.resolution().get();
    } finally {
      inFlight.pop();
      if (inFlight.isEmpty()) IN_FLIGHT.remove();
    }
    if (value == null) throw new IllegalStateException("Deferred resolution returned null for " + ref.declared());

    T winner = ref.publish(value);
    if (log.isDebugEnabled()) {
      log.debug("strata.deferred_resolved from={} to={} scope={} durationMs={} reusedConcurrent={}",
          ref.fromType(), ref.toType(), ref.scope(), (System.nanoTime() - t0) / 1_000_000.0, winner != value);
    }
    return winner;
  }

  /** Every (from, to, scope) declared through this resolver so far. */
  public Set<DeclaredReference> declaredReferences() {
    return Set.copyOf(declared);
  }

  private static String describe(Deque<DeferredReference<?>> inFlight, DeferredReference<?> next) {
    List<DeferredReference<?>> chain = new ArrayList<>(inFlight);
    Collections.reverse(chain);
    chain.add(next);
    return chain.stream()
        .map(r -> r.fromType() + " -> " + r.toType())
        .collect(Collectors.joining(", "));
  }
}
