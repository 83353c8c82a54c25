package org.kartograph.mutations.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import org.kartograph.mutations.dto.ProblemDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for the mutation server.
 * Converts exceptions to RFC 7807 problem+json responses and counts them by error code.
 * Batch outcomes are not exceptions; they are returned as mutation results by the controller.
 */
@ControllerAdvice
public class GraphExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(GraphExceptionHandler.class);

  private static final MediaType PROBLEM_JSON =
      MediaType.parseMediaType("application/problem+json");

  private final MeterRegistry meterRegistry;

  /**
   * Constructs a GraphExceptionHandler.
   *
   * @param meterRegistry the meter registry for metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry is a Spring-managed bean, not a mutable data structure"
  )
  public GraphExceptionHandler(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * Handle all domain exceptions.
   *
   * @param ex the domain exception
   * @return RFC 7807 problem+json response
   */
  @ExceptionHandler(KartographException.class)
  public ResponseEntity<ProblemDetail> handleKartographException(KartographException ex) {
    return problem(ex.getMessage(), HttpStatus.valueOf(ex.getStatus()), ex.getCode());
  }

  /**
   * Handle IllegalArgumentException (e.g., blank session id or slug).
   *
   * @param ex the exception
   * @return 400 problem+json response
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    return problem(ex.getMessage(), HttpStatus.BAD_REQUEST, "invalid_argument");
  }

  /**
   * Handle missing or wrongly typed request parameters.
   *
   * @param ex the exception
   * @return 400 problem+json response
   */
  @ExceptionHandler({
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ProblemDetail> handleBadParameter(Exception ex) {
    return problem(ex.getMessage(), HttpStatus.BAD_REQUEST, "invalid_argument");
  }

  /**
   * Handle a missing request body.
   *
   * @param ex the exception
   * @return 400 problem+json response
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return problem("Request body is missing or unreadable", HttpStatus.BAD_REQUEST,
        "invalid_request_body");
  }

  /**
   * Handle a request body in an unsupported media type.
   *
   * @param ex the exception
   * @return 415 problem+json response
   */
  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleUnsupportedMediaType(
      HttpMediaTypeNotSupportedException ex) {
    return problem(ex.getMessage(), HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        "unsupported_media_type");
  }

  /**
   * Handle framework exceptions that already carry a status.
   *
   * @param ex the exception
   * @return problem+json response with the exception's status
   */
  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<ProblemDetail> handleErrorResponse(ErrorResponseException ex) {
    HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
    String title = ex.getBody().getDetail() != null
        ? ex.getBody().getDetail()
        : status.getReasonPhrase();
    return problem(title, status, "http_" + status.value());
  }

  /**
   * Handle unexpected exceptions.
   *
   * @param ex the exception
   * @return 500 problem+json response
   */
  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ProblemDetail> handleUnexpected(RuntimeException ex) {
    logger.error("Unhandled exception", ex);
    return problem("Internal server error", HttpStatus.INTERNAL_SERVER_ERROR, "internal_error");
  }

  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  private ResponseEntity<ProblemDetail> problem(String title, HttpStatus status, String code) {
    meterRegistry.counter("kartograph.errors", "code", code).increment();
    ProblemDetail problem = new ProblemDetail(title, status.value(), code);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(PROBLEM_JSON);

    return new ResponseEntity<>(problem, headers, status);
  }
}
