package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * Summary of one decoded operation for authoring surfaces.
 *
 * @param index batch index
 * @param op operation kind
 * @param type node or edge
 * @param label label, when the operation carries one
 * @param id entity id, when the operation carries one
 * @param line 1-based source line
 * @param warnings warnings for this operation
 */
@Schema(description = "Decoded operation")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationPreview(
    int index,
    String op,
    String type,
    String label,
    String id,
    int line,
    List<String> warnings
) {
  /**
   * Compact constructor with defensive copying.
   */
  public OperationPreview {
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }
}
