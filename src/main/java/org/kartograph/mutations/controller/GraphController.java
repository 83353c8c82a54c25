package org.kartograph.mutations.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.kartograph.mutations.domain.GraphEdge;
import org.kartograph.mutations.domain.GraphNode;
import org.kartograph.mutations.dto.NeighborsResponse;
import org.kartograph.mutations.service.GraphQueryService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read endpoints over committed graph state.
 */
@RestController
@RequestMapping(path = "/graph", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Graph", description = "Committed nodes and edges")
public class GraphController {

  private final GraphQueryService queryService;

  /**
   * Constructor for GraphController.
   *
   * @param queryService the graph query service
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public GraphController(GraphQueryService queryService) {
    this.queryService = queryService;
  }

  /**
   * Gets a node.
   *
   * @param id the node id
   * @return the node
   */
  @GetMapping("/nodes/{id}")
  @Operation(summary = "Get node")
  @ApiResponse(responseCode = "200", description = "The node",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "404", description = "Node not found",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<GraphNode> getNode(
      @Parameter(description = "Node id", example = "person:a1b2c3d4e5f67890")
      @PathVariable String id) {
    return ResponseEntity.ok(queryService.getNode(id));
  }

  /**
   * Gets an edge.
   *
   * @param id the edge id
   * @return the edge
   */
  @GetMapping("/edges/{id}")
  @Operation(summary = "Get edge")
  @ApiResponse(responseCode = "200", description = "The edge",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "404", description = "Edge not found",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<GraphEdge> getEdge(@PathVariable String id) {
    return ResponseEntity.ok(queryService.getEdge(id));
  }

  /**
   * Gets a node with its incident edges and neighbouring nodes.
   *
   * @param id the node id
   * @return the neighbourhood
   */
  @GetMapping("/nodes/{id}/neighbors")
  @Operation(summary = "Get node neighbourhood")
  @ApiResponse(responseCode = "200", description = "Node, incident edges and neighbours",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "404", description = "Node not found",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<NeighborsResponse> getNeighbors(@PathVariable String id) {
    return ResponseEntity.ok(queryService.neighbors(id));
  }

  /**
   * Finds nodes by slug.
   *
   * @param slug the slug
   * @param nodeType optional label filter
   * @return matching nodes
   */
  @GetMapping("/nodes/by-slug")
  @Operation(summary = "Find nodes by slug")
  @ApiResponse(responseCode = "200", description = "Matching nodes",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "400", description = "Blank slug",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<List<GraphNode>> findBySlug(
      @RequestParam String slug,
      @Parameter(description = "Only nodes with this label", example = "person")
      @RequestParam(name = "node_type", required = false) String nodeType) {
    return ResponseEntity.ok(queryService.findBySlug(slug, nodeType));
  }
}
