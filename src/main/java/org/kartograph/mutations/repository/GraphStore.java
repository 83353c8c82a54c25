package org.kartograph.mutations.repository;

import java.util.List;
import java.util.Optional;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;

/**
 * Durable property-graph storage with atomic multi-operation transactions.
 * Reads outside a transaction observe committed state only.
 */
public interface GraphStore {

  /**
   * Finds a committed node by id.
   *
   * @param id the node id
   * @return the node, or empty if absent
   */
  Optional<GraphNode> findNode(String id);

  /**
   * Finds a committed edge by id.
   *
   * @param id the edge id
   * @return the edge, or empty if absent
   */
  Optional<GraphEdge> findEdge(String id);

  /**
   * Finds committed edges starting or ending at a node.
   *
   * @param nodeId the node id
   * @return incident edges
   */
  List<GraphEdge> findIncidentEdges(String nodeId);

  /**
   * Finds committed nodes by their {@code slug} property.
   *
   * @param slug the slug
   * @param label optional label filter (null for any label)
   * @return matching nodes
   */
  List<GraphNode> findNodesBySlug(String slug, String label);

  /**
   * Counts committed nodes.
   *
   * @return node count
   */
  long nodeCount();

  /**
   * Counts committed edges.
   *
   * @return edge count
   */
  long edgeCount();

  /**
   * Begins a transaction. The caller must commit or close it on the same thread.
   *
   * @return the transaction
   */
  GraphTransaction begin();
}
