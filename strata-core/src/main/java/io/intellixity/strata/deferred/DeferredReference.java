package io.intellixity.strata.deferred;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * A postponed dependency of one entity type on another.\n
 *
 * Holding a DeferredReference never loads the referenced type's unit; only {@link #get()} (or
 * {@link DeferredReferenceResolver#resolve}) runs the resolution function. The first non-null result is cached; a
 * racing second resolution is discarded in favour of the cached one.\n
 */
public final class DeferredReference<T> implements Supplier<T> {
  private final DeferredReferenceResolver resolver;
  private final DeclaredReference declared;
  private final Supplier<? extends T> resolution;
  private final AtomicReference<T> resolved = new AtomicReference<>();

  DeferredReference(DeferredReferenceResolver resolver, DeclaredReference declared, Supplier<? extends T> resolution) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.declared = Objects.requireNonNull(declared, "declared");
    this.resolution = Objects.requireNonNull(resolution, "resolution");
  }

  public String fromType() { return declared.fromType(); }
  public String toType() { return declared.toType(); }
  public ReferenceScope scope() { return declared.scope(); }
  public DeclaredReference declared() { return declared; }

  /** Resolve (first use) or return the cached facility. */
  @Override
  public T get() {
    return resolver.resolve(this);
  }

  public boolean isResolved() {
    return resolved.get() != null;
  }

  T cached() {
    return resolved.get();
  }

  Supplier<? extends T> resolution() {
    return resolution;
  }

  /** Publish {@code value} unless another thread got there first; returns the value every caller must use. */
  T publish(T value) {
    if (resolved.compareAndSet(null, value)) return value;
    return resolved.get();
  }

  @Override
  public String toString() {
    return "DeferredReference[" + declared + (isResolved() ? ", resolved" : "") + "]";
  }
}
