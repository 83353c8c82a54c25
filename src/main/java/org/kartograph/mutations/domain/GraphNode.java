package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.kartograph.mutations.util.PropertyMaps;

/**
 * Immutable snapshot of a stored node.
 *
 * @param id unique id
 * @param label node label
 * @param properties node properties
 */
public record GraphNode(String id, String label, Map<String, Object> properties) {

  /**
   * Creates a node snapshot.
   */
  public GraphNode {
    Objects.requireNonNull(id, "Node id cannot be null");
    Objects.requireNonNull(label, "Node label cannot be null");
    properties = properties != null ? PropertyMaps.immutableCopy(properties) : Map.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable map created in constructor")
  @Override
  public Map<String, Object> properties() {
    return properties;
  }

  /**
   * Returns a copy of this node with the given properties replaced or added.
   *
   * @param updates properties to write
   * @return the updated node
   */
  public GraphNode withProperties(Map<String, Object> updates) {
    Map<String, Object> merged = new LinkedHashMap<>(properties);
    merged.putAll(updates);
    return new GraphNode(id, label, merged);
  }

  /**
   * Returns a copy of this node without the given properties.
   *
   * @param names property names to remove
   * @return the updated node
   */
  public GraphNode withoutProperties(Iterable<String> names) {
    Map<String, Object> remaining = new LinkedHashMap<>(properties);
    names.forEach(remaining::remove);
    return new GraphNode(id, label, remaining);
  }
}
