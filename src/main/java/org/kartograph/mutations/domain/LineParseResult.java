package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * Raw output of the line parser: decoded operations plus line-scoped fatal errors.
 *
 * @param operations decoded operations in input order
 * @param errors parse and shape errors, in line order
 */
public record LineParseResult(List<MutationOperation> operations, List<BatchError> errors) {

  /**
   * Creates a parse result with immutable copies.
   */
  public LineParseResult {
    operations = operations != null ? List.copyOf(operations) : List.of();
    errors = errors != null ? List.copyOf(errors) : List.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<MutationOperation> operations() {
    return operations;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<BatchError> errors() {
    return errors;
  }
}
