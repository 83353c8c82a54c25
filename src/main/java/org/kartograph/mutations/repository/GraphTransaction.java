package org.kartograph.mutations.repository;

import java.util.List;
import java.util.Optional;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;

/**
 * Unit of work against a {@link GraphStore}.
 * Reads see the transaction's own staged writes. Nothing is visible to other readers until
 * {@link #commit()}; {@link #close()} without a commit discards every staged write.
 */
public interface GraphTransaction extends AutoCloseable {

  /**
   * Returns the transaction id, for logging.
   *
   * @return time-ordered transaction id
   */
  String transactionId();

  Optional<GraphNode> findNode(String id);

  Optional<GraphEdge> findEdge(String id);

  /**
   * Finds edges starting or ending at a node, including staged ones.
   *
   * @param nodeId the node id
   * @return incident edges
   */
  List<GraphEdge> findIncidentEdges(String nodeId);

  /**
   * Stages a node write (insert or replace).
   *
   * @param node the node
   */
  void putNode(GraphNode node);

  /**
   * Stages an edge write (insert or replace).
   *
   * @param edge the edge
   * @throws IllegalStateException if an endpoint node does not exist
   */
  void putEdge(GraphEdge edge);

  /**
   * Stages a node removal.
   *
   * @param id the node id
   * @throws IllegalStateException if edges still reference the node
   */
  void removeNode(String id);

  /**
   * Stages an edge removal.
   *
   * @param id the edge id
   */
  void removeEdge(String id);

  /**
   * Publishes all staged writes atomically.
   *
   * @throws IllegalStateException if the transaction is no longer active
   */
  void commit();

  /**
   * Discards all staged writes.
   */
  void rollback();

  /**
   * Rolls back unless committed, and releases the transaction.
   */
  @Override
  void close();
}
