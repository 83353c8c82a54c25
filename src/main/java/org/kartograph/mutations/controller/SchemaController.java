package org.kartograph.mutations.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.TypeDefinition;
import org.kartograph.mutations.dto.TypeDefinitionListResponse;
import org.kartograph.mutations.service.SchemaService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Schema registry browsing.
 */
@RestController
@RequestMapping(path = "/graph/schema", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Schema", description = "Registered node and edge type definitions")
public class SchemaController {

  private final SchemaService schemaService;

  /**
   * Constructor for SchemaController.
   *
   * @param schemaService the schema service
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public SchemaController(SchemaService schemaService) {
    this.schemaService = schemaService;
  }

  /**
   * Lists node type definitions.
   *
   * @param search substring of label or description
   * @param hasProperty property the type must declare
   * @return matching definitions
   */
  @GetMapping("/nodes")
  @Operation(summary = "List node types")
  @ApiResponse(responseCode = "200", description = "Node type definitions",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  public ResponseEntity<TypeDefinitionListResponse> listNodeTypes(
      @Parameter(description = "Case-insensitive label or description filter")
      @RequestParam(required = false) String search,
      @Parameter(description = "Only types declaring this property", example = "name")
      @RequestParam(name = "has_property", required = false) String hasProperty) {
    return ResponseEntity.ok(TypeDefinitionListResponse.of(
        schemaService.list(EntityKind.NODE, search, hasProperty)));
  }

  /**
   * Lists edge type definitions.
   *
   * @param search substring of label or description
   * @return matching definitions
   */
  @GetMapping("/edges")
  @Operation(summary = "List edge types")
  @ApiResponse(responseCode = "200", description = "Edge type definitions",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  public ResponseEntity<TypeDefinitionListResponse> listEdgeTypes(
      @Parameter(description = "Case-insensitive label or description filter")
      @RequestParam(required = false) String search) {
    return ResponseEntity.ok(TypeDefinitionListResponse.of(
        schemaService.list(EntityKind.EDGE, search, null)));
  }

  /**
   * Gets a node type definition.
   *
   * @param label the label
   * @return the definition
   */
  @GetMapping("/nodes/{label}")
  @Operation(summary = "Get node type")
  @ApiResponse(responseCode = "200", description = "Node type definition",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "404", description = "No definition for the label",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<TypeDefinition> getNodeType(@PathVariable String label) {
    return ResponseEntity.ok(schemaService.get(EntityKind.NODE, label));
  }

  /**
   * Gets an edge type definition.
   *
   * @param label the label
   * @return the definition
   */
  @GetMapping("/edges/{label}")
  @Operation(summary = "Get edge type")
  @ApiResponse(responseCode = "200", description = "Edge type definition",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "404", description = "No definition for the label",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<TypeDefinition> getEdgeType(@PathVariable String label) {
    return ResponseEntity.ok(schemaService.get(EntityKind.EDGE, label));
  }
}
