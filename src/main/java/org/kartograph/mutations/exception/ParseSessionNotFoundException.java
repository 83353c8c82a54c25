package org.kartograph.mutations.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a parse session is unknown or has expired.
 * Maps to HTTP 404 Not Found with error code "parse_session_not_found".
 */
public class ParseSessionNotFoundException extends KartographException {

  private static final long serialVersionUID = 1L;
  private static final String ERROR_CODE = "parse_session_not_found";

  /**
   * Constructor with session id.
   *
   * @param sessionId the session id
   */
  public ParseSessionNotFoundException(String sessionId) {
    super("Parse session not found: " + sessionId, ERROR_CODE, HttpStatus.NOT_FOUND);
  }
}
