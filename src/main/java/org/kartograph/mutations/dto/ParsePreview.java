package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * Diagnostics for a mutation batch, as shown while it is being edited.
 *
 * @param mode full preview or read-only breakdown
 * @param breakdown operation counts per kind
 * @param errors fatal errors (capped in summary mode)
 * @param errorCount total fatal errors
 * @param warnings warnings (capped)
 * @param warningCount total warnings
 * @param operations decoded operations (capped on the background path)
 * @param operationsTruncated whether {@code operations} was capped
 * @param parseTimeMs time spent parsing and validating
 * @param submittable whether the batch would be accepted for apply
 */
@Schema(description = "Parse and validation result for a mutation batch")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsePreview(
    PreviewMode mode,
    OperationBreakdown breakdown,
    List<String> errors,
    @JsonProperty("error_count") int errorCount,
    List<WarningEntry> warnings,
    @JsonProperty("warning_count") int warningCount,
    List<OperationPreview> operations,
    @JsonProperty("operations_truncated") boolean operationsTruncated,
    @JsonProperty("parse_time_ms") long parseTimeMs,
    boolean submittable
) {
  /**
   * Compact constructor with defensive copying.
   */
  public ParsePreview {
    errors = errors != null ? List.copyOf(errors) : List.of();
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
    operations = operations != null ? List.copyOf(operations) : List.of();
  }
}
