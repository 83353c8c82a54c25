package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;

/**
 * A decoded operation annotated with its non-blocking warnings.
 *
 * @param operation the operation
 * @param warnings schema and shape warnings for author review
 */
public record ParsedOperation(MutationOperation operation, List<String> warnings) {

  /**
   * Creates an annotated operation.
   */
  public ParsedOperation {
    Objects.requireNonNull(operation, "Operation cannot be null");
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<String> warnings() {
    return warnings;
  }
}
