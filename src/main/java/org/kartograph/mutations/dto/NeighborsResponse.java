package org.kartograph.mutations.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;

/**
 * A node with its incident edges and the nodes at their other ends.
 *
 * @param node the centre node
 * @param edges edges starting or ending at the node
 * @param neighbors distinct nodes at the other end of those edges
 */
@Schema(description = "Node neighbourhood")
public record NeighborsResponse(
    GraphNode node,
    List<GraphEdge> edges,
    List<GraphNode> neighbors
) {
  /**
   * Compact constructor with defensive copying.
   */
  public NeighborsResponse {
    edges = edges != null ? List.copyOf(edges) : List.of();
    neighbors = neighbors != null ? List.copyOf(neighbors) : List.of();
  }
}
