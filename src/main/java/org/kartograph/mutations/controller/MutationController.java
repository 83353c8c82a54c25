package org.kartograph.mutations.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.kartograph.mutations.domain.BatchOutcome;
import org.kartograph.mutations.domain.MutationResult;
import org.kartograph.mutations.dto.ParsePreview;
import org.kartograph.mutations.service.GraphMutationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints for submitting and dry-running mutation batches.
 * The request body is the raw JSONL batch.
 */
@RestController
@RequestMapping("/graph/mutations")
@Tag(name = "Mutations", description = "Apply and validate JSONL mutation batches")
public class MutationController {

  static final String NDJSON = "application/x-ndjson";
  static final String JSONL = "application/jsonl";

  private final GraphMutationService mutationService;

  /**
   * Constructor for MutationController.
   *
   * @param mutationService the mutation service
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public MutationController(GraphMutationService mutationService) {
    this.mutationService = mutationService;
  }

  /**
   * Applies a batch atomically.
   *
   * @param jsonl the batch
   * @return the mutation result; 200 when committed, 422 when rejected, 409 when aborted
   */
  @PostMapping(
      consumes = {MediaType.TEXT_PLAIN_VALUE, NDJSON, JSONL},
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Timed(value = "kartograph.http.mutations.apply", description = "Batch submission time")
  @Operation(
      summary = "Apply mutation batch",
      description = "Parses, validates and applies a JSONL batch as one transaction. "
          + "Either every operation takes effect or none does."
  )
  @ApiResponse(
      responseCode = "200",
      description = "Batch committed",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
          schema = @Schema(implementation = MutationResult.class))
  )
  @ApiResponse(
      responseCode = "422",
      description = "Batch has parse or structural errors and was not applied",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
          schema = @Schema(implementation = MutationResult.class))
  )
  @ApiResponse(
      responseCode = "409",
      description = "An operation failed during apply; the batch was rolled back",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
          schema = @Schema(implementation = MutationResult.class))
  )
  public ResponseEntity<MutationResult> apply(@RequestBody(required = false) String jsonl) {
    BatchOutcome outcome = mutationService.applyJsonl(jsonl);
    return ResponseEntity.status(statusOf(outcome.status())).body(outcome.result());
  }

  /**
   * Parses and validates a batch without applying it.
   *
   * @param jsonl the batch
   * @return the full preview
   */
  @PostMapping(
      path = "/validate",
      consumes = {MediaType.TEXT_PLAIN_VALUE, NDJSON, JSONL},
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Validate mutation batch",
      description = "Dry run: returns errors, warnings, the operation breakdown and every "
          + "decoded operation. Uses the same validation as apply."
  )
  @ApiResponse(
      responseCode = "200",
      description = "Validation result",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
          schema = @Schema(implementation = ParsePreview.class))
  )
  public ResponseEntity<ParsePreview> validate(@RequestBody(required = false) String jsonl) {
    return ResponseEntity.ok(mutationService.validate(jsonl));
  }

  private static HttpStatus statusOf(BatchOutcome.Status status) {
    switch (status) {
      case COMMITTED:
        return HttpStatus.OK;
      case REJECTED:
        return HttpStatus.UNPROCESSABLE_ENTITY;
      case ABORTED:
        return HttpStatus.CONFLICT;
      default:
        throw new IllegalStateException("Unhandled batch status: " + status);
    }
  }
}
