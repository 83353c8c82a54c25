package org.kartograph.mutations.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of graph entity a mutation targets.
 */
public enum EntityKind {
  NODE("node"),
  EDGE("edge");

  private final String wireValue;

  EntityKind(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the value used for this kind in mutation lines ({@code "node"} or {@code "edge"}).
   *
   * @return the wire value
   */
  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /**
   * Resolves a wire value to an entity kind. Matching ignores case, the same way
   * {@link OperationKind#fromWire(String)} does, so {@code "NODE"} and {@code "node"} are
   * the same kind.
   *
   * @param value the wire value
   * @return the entity kind, or empty if the value is not recognized
   */
  public static Optional<EntityKind> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (EntityKind kind : values()) {
      if (kind.wireValue.equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
