package org.kartograph.mutations.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;
import org.kartograph.mutations.dto.NeighborsResponse;
import org.kartograph.mutations.exception.EntityNotFoundException;
import org.kartograph.mutations.repository.GraphStore;
import org.springframework.stereotype.Service;

/**
 * Read access to committed graph state.
 */
@Service
public class GraphQueryService {

  private final GraphStore graphStore;

  /**
   * Constructs a GraphQueryService.
   *
   * @param graphStore the graph store
   */
  public GraphQueryService(GraphStore graphStore) {
    this.graphStore = graphStore;
  }

  /**
   * Gets a node.
   *
   * @param id the node id
   * @return the node
   * @throws EntityNotFoundException if the node does not exist
   */
  public GraphNode getNode(String id) {
    return graphStore.findNode(id)
        .orElseThrow(() -> new EntityNotFoundException(EntityKind.NODE, id));
  }

  /**
   * Gets an edge.
   *
   * @param id the edge id
   * @return the edge
   * @throws EntityNotFoundException if the edge does not exist
   */
  public GraphEdge getEdge(String id) {
    return graphStore.findEdge(id)
        .orElseThrow(() -> new EntityNotFoundException(EntityKind.EDGE, id));
  }

  /**
   * Gets a node with its incident edges and neighbouring nodes.
   *
   * @param id the node id
   * @return the neighbourhood
   * @throws EntityNotFoundException if the node does not exist
   */
  public NeighborsResponse neighbors(String id) {
    GraphNode node = getNode(id);
    List<GraphEdge> edges = graphStore.findIncidentEdges(id);
    Set<String> neighborIds = new LinkedHashSet<>();
    for (GraphEdge edge : edges) {
      neighborIds.add(edge.startId().equals(id) ? edge.endId() : edge.startId());
    }
    List<GraphNode> neighbors = new ArrayList<>(neighborIds.size());
    // A commit may land between the reads above; skip nodes that are gone by now.
    neighborIds.forEach(neighborId -> graphStore.findNode(neighborId).ifPresent(neighbors::add));
    return new NeighborsResponse(node, edges, neighbors);
  }

  /**
   * Finds nodes by slug.
   *
   * @param slug the slug
   * @param nodeType optional label filter
   * @return matching nodes
   * @throws IllegalArgumentException if the slug is blank
   */
  public List<GraphNode> findBySlug(String slug, String nodeType) {
    if (slug == null || slug.isBlank()) {
      throw new IllegalArgumentException("Slug cannot be blank");
    }
    String label = nodeType != null && !nodeType.isBlank() ? nodeType : null;
    return graphStore.findNodesBySlug(slug, label);
  }
}
