package org.kartograph.mutations.service;

import java.util.List;
import java.util.Locale;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.TypeDefinition;
import org.kartograph.mutations.exception.TypeDefinitionNotFoundException;
import org.kartograph.mutations.repository.TypeDefinitionRepository;
import org.springframework.stereotype.Service;

/**
 * Read-only browsing of the schema registry.
 */
@Service
public class SchemaService {

  private final TypeDefinitionRepository registry;

  /**
   * Constructs a SchemaService.
   *
   * @param registry the schema registry
   */
  public SchemaService(TypeDefinitionRepository registry) {
    this.registry = registry;
  }

  /**
   * Lists definitions of one entity kind, ordered by label.
   *
   * @param kind node or edge
   * @param search case-insensitive substring of the label or description (null for all)
   * @param hasProperty property that must be declared required or optional (null for any)
   * @return matching definitions
   */
  public List<TypeDefinition> list(EntityKind kind, String search, String hasProperty) {
    String needle = search != null && !search.isBlank()
        ? search.trim().toLowerCase(Locale.ROOT)
        : null;
    return registry.findAll(kind).stream()
        .filter(definition -> needle == null || matches(definition, needle))
        .filter(definition -> hasProperty == null || hasProperty.isBlank()
            || definition.declares(hasProperty))
        .toList();
  }

  /**
   * Gets one definition.
   *
   * @param kind node or edge
   * @param label the label
   * @return the definition
   * @throws TypeDefinitionNotFoundException if no definition exists
   */
  public TypeDefinition get(EntityKind kind, String label) {
    return registry.find(kind, label)
        .orElseThrow(() -> new TypeDefinitionNotFoundException(kind, label));
  }

  private static boolean matches(TypeDefinition definition, String needle) {
    if (definition.label().toLowerCase(Locale.ROOT).contains(needle)) {
      return true;
    }
    return definition.description() != null
        && definition.description().toLowerCase(Locale.ROOT).contains(needle);
  }
}
