package org.kartograph.mutations.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import org.kartograph.mutations.domain.TypeDefinition;

/**
 * Registered type definitions of one entity kind.
 *
 * @param definitions the definitions, ordered by label
 * @param count number of definitions
 */
@Schema(description = "Type definitions")
public record TypeDefinitionListResponse(
    List<TypeDefinition> definitions,
    int count
) {
  /**
   * Compact constructor with defensive copying.
   */
  public TypeDefinitionListResponse {
    definitions = definitions != null ? List.copyOf(definitions) : List.of();
  }

  /**
   * Creates a response from a list.
   *
   * @param definitions the definitions
   * @return the response
   */
  public static TypeDefinitionListResponse of(List<TypeDefinition> definitions) {
    return new TypeDefinitionListResponse(definitions, definitions.size());
  }
}
