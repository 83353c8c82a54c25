package org.kartograph.mutations.domain;

import java.util.Objects;

/**
 * How a submitted batch ended, together with its result.
 *
 * @param status committed, rejected before apply, or aborted during apply
 * @param result the mutation result returned to the producer
 */
public record BatchOutcome(Status status, MutationResult result) {

  /**
   * Terminal status of a submitted batch.
   */
  public enum Status {
    /** All operations took effect. */
    COMMITTED,
    /** Parse or structural errors; the store was never touched. */
    REJECTED,
    /** An operation failed during apply; the transaction was rolled back. */
    ABORTED
  }

  /**
   * Creates a batch outcome.
   */
  public BatchOutcome {
    Objects.requireNonNull(status, "Status cannot be null");
    Objects.requireNonNull(result, "Result cannot be null");
  }
}
