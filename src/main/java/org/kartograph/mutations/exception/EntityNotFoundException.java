package org.kartograph.mutations.exception;

import org.kartograph.mutations.domain.EntityKind;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a requested node or edge does not exist.
 * Maps to HTTP 404 Not Found with error code "entity_not_found".
 */
public class EntityNotFoundException extends KartographException {

  private static final long serialVersionUID = 1L;
  private static final String ERROR_CODE = "entity_not_found";

  /**
   * Constructor with entity kind and id.
   *
   * @param kind node or edge
   * @param id the id that was not found
   */
  public EntityNotFoundException(EntityKind kind, String id) {
    super(capitalize(kind.wireValue()) + " not found: " + id, ERROR_CODE, HttpStatus.NOT_FOUND);
  }

  private static String capitalize(String value) {
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
