package org.kartograph.mutations.domain;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Helpers for the canonical entity id shape {@code <label-prefix>:<16 lowercase hex>}.
 *
 * <p>The graph store treats ids as opaque unique keys; the canonical shape is only
 * enforced as a warning.
 */
public final class EntityId {

  /**
   * Canonical id pattern.
   */
  public static final Pattern CANONICAL = Pattern.compile("^[a-z0-9_]+:[0-9a-f]{16}$");

  private EntityId() {
    // Utility class
  }

  /**
   * Checks whether an id has the canonical shape.
   *
   * @param id the id (may be null)
   * @return true if the id matches {@link #CANONICAL}
   */
  public static boolean isCanonical(String id) {
    return id != null && CANONICAL.matcher(id).matches();
  }

  /**
   * Extracts the label prefix of a canonical id.
   *
   * @param id the id
   * @return the part before the colon, or empty if the id is not canonical
   */
  public static Optional<String> labelPrefix(String id) {
    if (!isCanonical(id)) {
      return Optional.empty();
    }
    return Optional.of(id.substring(0, id.indexOf(':')));
  }
}
