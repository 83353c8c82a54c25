package org.kartograph.mutations.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * Outcome of submitting a mutation batch.
 * A batch is one transaction: a failed result never reports applied operations.
 *
 * @param success whether the batch committed
 * @param operationsApplied operations that took effect (0 unless committed)
 * @param errors error messages (empty on success)
 */
public record MutationResult(
    boolean success,
    @JsonProperty("operations_applied") int operationsApplied,
    List<String> errors) {

  /**
   * Creates a result.
   *
   * @throws IllegalArgumentException if a failed result reports applied operations
   */
  public MutationResult {
    errors = errors != null ? List.copyOf(errors) : List.of();
    if (operationsApplied < 0) {
      throw new IllegalArgumentException("Applied operation count cannot be negative");
    }
    if (!success && operationsApplied != 0) {
      throw new IllegalArgumentException(
          "A failed batch contributes nothing to the store; operationsApplied must be 0");
    }
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<String> errors() {
    return errors;
  }

  /**
   * Result of a committed batch.
   *
   * @param operationsApplied number of operations in the batch
   * @return successful result
   */
  public static MutationResult committed(int operationsApplied) {
    return new MutationResult(true, operationsApplied, List.of());
  }

  /**
   * Result of a batch that was rejected or rolled back.
   *
   * @param errors the errors
   * @return failed result
   */
  public static MutationResult failed(List<String> errors) {
    return new MutationResult(false, 0, errors);
  }
}
