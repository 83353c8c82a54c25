package org.kartograph.mutations.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for request-level errors of the mutation server.
 * Carries a machine-readable error code and the HTTP status it maps to.
 */
public class KartographException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;
  private final int status;

  /**
   * Constructor with message, code, and status.
   *
   * @param message error message
   * @param code canonical error code
   * @param status HTTP status
   */
  public KartographException(String message, String code, HttpStatus status) {
    super(message);
    this.code = code;
    this.status = status.value();
  }

  public String getCode() {
    return code;
  }

  public int getStatus() {
    return status;
  }
}
