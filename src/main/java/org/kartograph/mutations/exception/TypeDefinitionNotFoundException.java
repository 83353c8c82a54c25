package org.kartograph.mutations.exception;

import org.kartograph.mutations.domain.EntityKind;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when no type definition exists for a label.
 * Maps to HTTP 404 Not Found with error code "type_definition_not_found".
 */
public class TypeDefinitionNotFoundException extends KartographException {

  private static final long serialVersionUID = 1L;
  private static final String ERROR_CODE = "type_definition_not_found";

  /**
   * Constructor with entity kind and label.
   *
   * @param kind node or edge
   * @param label the label that has no definition
   */
  public TypeDefinitionNotFoundException(EntityKind kind, String label) {
    super("No " + kind.wireValue() + " type definition for label: " + label,
        ERROR_CODE, HttpStatus.NOT_FOUND);
  }
}
