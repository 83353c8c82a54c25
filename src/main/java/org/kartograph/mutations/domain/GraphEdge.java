package org.kartograph.mutations.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.kartograph.mutations.util.PropertyMaps;

/**
 * Immutable snapshot of a stored relationship.
 *
 * @param id unique id
 * @param label relationship type
 * @param startId source node id
 * @param endId target node id
 * @param properties edge properties
 */
public record GraphEdge(
    String id,
    String label,
    @JsonProperty("start_id") String startId,
    @JsonProperty("end_id") String endId,
    Map<String, Object> properties) {

  /**
   * Creates an edge snapshot.
   */
  public GraphEdge {
    Objects.requireNonNull(id, "Edge id cannot be null");
    Objects.requireNonNull(label, "Edge label cannot be null");
    Objects.requireNonNull(startId, "Edge start id cannot be null");
    Objects.requireNonNull(endId, "Edge end id cannot be null");
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
   * Checks whether this edge starts or ends at a node.
   *
   * @param nodeId the node id
   * @return true if the node is an endpoint
   */
  public boolean touches(String nodeId) {
    return startId.equals(nodeId) || endId.equals(nodeId);
  }

  /**
   * Returns a copy of this edge with the given properties replaced or added.
   *
   * @param updates properties to write
   * @return the updated edge
   */
  public GraphEdge withProperties(Map<String, Object> updates) {
    Map<String, Object> merged = new LinkedHashMap<>(properties);
    merged.putAll(updates);
    return new GraphEdge(id, label, startId, endId, merged);
  }

  /**
   * Returns a copy of this edge without the given properties.
   *
   * @param names property names to remove
   * @return the updated edge
   */
  public GraphEdge withoutProperties(Iterable<String> names) {
    Map<String, Object> remaining = new LinkedHashMap<>(properties);
    names.forEach(remaining::remove);
    return new GraphEdge(id, label, startId, endId, remaining);
  }
}
