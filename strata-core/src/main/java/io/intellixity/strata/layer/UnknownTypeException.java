package io.intellixity.strata.layer;

/**
 * Raised when an entity type name is absent from the layer table.
 * <p>
 * Always a programmer error: the table is part of the source, so an unknown name means a typo or a type that was
 * never classified.
 */
public final class UnknownTypeException extends RuntimeException {
  private final String typeName;

  public UnknownTypeException(String typeName) {
    super("Unknown entity type: " + typeName);
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }
}
