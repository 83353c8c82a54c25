package org.kartograph.mutations.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminator of a mutation line (the {@code op} field).
 */
public enum OperationKind {
  DEFINE,
  CREATE,
  UPDATE,
  DELETE;

  /**
   * Resolves an {@code op} value. Matching ignores case, so {@code "create"} and
   * {@code "CREATE"} are the same operation.
   *
   * @param value the raw discriminator
   * @return the operation kind, or empty if the value names no known operation
   */
  public static Optional<OperationKind> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
