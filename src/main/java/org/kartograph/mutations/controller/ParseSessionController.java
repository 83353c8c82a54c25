package org.kartograph.mutations.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.kartograph.mutations.domain.ParseState;
import org.kartograph.mutations.dto.ParseSessionView;
import org.kartograph.mutations.dto.ParseTicket;
import org.kartograph.mutations.service.ParseDispatcher;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Live parse feedback for editing sessions.
 */
@RestController
@RequestMapping("/graph/mutations/sessions/{sessionId}")
@Tag(name = "Parse Sessions", description = "Live diagnostics while a batch is edited")
public class ParseSessionController {

  private final ParseDispatcher dispatcher;

  /**
   * Constructor for ParseSessionController.
   *
   * @param dispatcher the parse dispatcher
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public ParseSessionController(ParseDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  /**
   * Submits the current text of a session.
   *
   * @param sessionId the editing session
   * @param text the full batch text
   * @return 200 with the result for small inputs, 202 when parsed in the background
   */
  @PostMapping(
      path = "/parse",
      consumes = {MediaType.TEXT_PLAIN_VALUE, MutationController.NDJSON,
          MutationController.JSONL},
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Parse session text",
      description = "Small inputs are parsed immediately. Large inputs are parsed in the "
          + "background; a newer request supersedes older ones."
  )
  @ApiResponse(responseCode = "200", description = "Parsed synchronously",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "202", description = "Accepted for background parsing",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "400", description = "Invalid session id",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<ParseTicket> parse(
      @Parameter(description = "Editing session id", required = true)
      @PathVariable String sessionId,
      @RequestBody(required = false) String text) {
    ParseTicket ticket = dispatcher.submit(sessionId, text);
    HttpStatus status =
        ticket.state() == ParseState.PARSING ? HttpStatus.ACCEPTED : HttpStatus.OK;
    return ResponseEntity.status(status).body(ticket);
  }

  /**
   * Gets the state of a session's latest request, or of one request.
   *
   * @param sessionId the editing session
   * @param sequence optional request sequence
   * @return the session view
   */
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Get session state",
      description = "Returns the state of the latest request and, once ready, its result. "
          + "Results of superseded requests are never returned."
  )
  @ApiResponse(responseCode = "200", description = "Session state",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "404", description = "Unknown or expired session",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<ParseSessionView> get(
      @PathVariable String sessionId,
      @Parameter(description = "Request sequence (defaults to the latest)")
      @RequestParam(required = false) Long sequence) {
    ParseSessionView view = sequence == null
        ? dispatcher.view(sessionId)
        : dispatcher.view(sessionId, sequence);
    return ResponseEntity.ok(view);
  }

  /**
   * Ends a session.
   *
   * @param sessionId the editing session
   * @return 204 No Content
   */
  @DeleteMapping
  @Operation(summary = "End session")
  @ApiResponse(responseCode = "204", description = "Session ended")
  @ApiResponse(responseCode = "404", description = "Unknown or expired session",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<Void> close(@PathVariable String sessionId) {
    dispatcher.close(sessionId);
    return ResponseEntity.noContent().build();
  }
}
