package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * Parsed and validated mutation batch.
 * A batch with any error must not be applied.
 *
 * @param operations operations in input order, each with its warnings
 * @param errors fatal parse and structural errors
 */
public record ParsedBatch(List<ParsedOperation> operations, List<BatchError> errors) {

  /**
   * Creates a parsed batch with immutable copies.
   */
  public ParsedBatch {
    operations = operations != null ? List.copyOf(operations) : List.of();
    errors = errors != null ? List.copyOf(errors) : List.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<ParsedOperation> operations() {
    return operations;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<BatchError> errors() {
    return errors;
  }

  /**
   * Checks whether the batch has fatal errors and must not be applied.
   *
   * @return true if any error is present
   */
  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /**
   * Returns the bare operations, without warnings.
   *
   * @return operations in input order
   */
  public List<MutationOperation> mutationOperations() {
    return operations.stream().map(ParsedOperation::operation).toList();
  }

  /**
   * Returns the formatted error messages.
   *
   * @return messages in line order
   */
  public List<String> errorMessages() {
    return errors.stream().map(BatchError::message).toList();
  }

  /**
   * Counts warnings across all operations.
   *
   * @return total warnings
   */
  public int warningCount() {
    return operations.stream().mapToInt(op -> op.warnings().size()).sum();
  }
}
