package org.kartograph.mutations.exception;

import org.kartograph.mutations.domain.MutationOperation;

/**
 * Exception thrown when an operation cannot take effect while a batch is applied.
 * The batch is rolled back; callers translate this into a failed mutation result.
 */
public class MutationApplyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int operationIndex;
  private final int line;
  private final String operationName;

  /**
   * Constructor with the failing operation and the reason.
   *
   * @param operation the operation that failed
   * @param reason why it failed
   */
  public MutationApplyException(MutationOperation operation, String reason) {
    super(reason);
    this.operationIndex = operation.index();
    this.line = operation.span().startLine();
    this.operationName = operation.kind().name();
  }

  public int getOperationIndex() {
    return operationIndex;
  }

  public int getLine() {
    return line;
  }

  /**
   * Formats the failure for authors, e.g.
   * {@code "Operation 3 (line 4) DELETE: node 'person:...' does not exist"}.
   *
   * @return the formatted message
   */
  public String toErrorMessage() {
    return "Operation " + operationIndex + " (line " + line + ") " + operationName + ": "
        + getMessage();
  }
}
