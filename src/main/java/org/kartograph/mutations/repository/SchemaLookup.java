package org.kartograph.mutations.repository;

import java.util.Optional;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.TypeDefinition;

/**
 * Read-only view of registered type definitions, as consumed by validation.
 */
@FunctionalInterface
public interface SchemaLookup {

  /**
   * Finds the definition of a label.
   *
   * @param entityKind node or edge
   * @param label the label
   * @return the definition, or empty if the label was never defined
   */
  Optional<TypeDefinition> find(EntityKind entityKind, String label);
}
