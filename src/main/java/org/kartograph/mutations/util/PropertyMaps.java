package org.kartograph.mutations.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for entity property maps.
 * Property values may be null (JSON {@code null}), so {@link Map#copyOf} cannot be used.
 */
public final class PropertyMaps {

  private PropertyMaps() {
    // Utility class
  }

  /**
   * Copies a property map into an unmodifiable map that keeps insertion order and null values.
   *
   * @param properties the source map
   * @return unmodifiable copy
   */
  public static Map<String, Object> immutableCopy(Map<String, ?> properties) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }
}
