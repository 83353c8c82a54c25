package org.kartograph.mutations.repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.TypeDefinition;
import org.springframework.stereotype.Repository;

/**
 * In-memory schema registry.
 * Thread-safe implementation using ConcurrentHashMap, keyed by (entity kind, label).
 * Definitions are replaced on save and never deleted.
 */
@Repository
public class TypeDefinitionRepository implements SchemaLookup {

  private final Map<EntityKind, Map<String, TypeDefinition>> definitions =
      new ConcurrentHashMap<>();

  @Override
  public Optional<TypeDefinition> find(EntityKind entityKind, String label) {
    return Optional.ofNullable(definitions.get(entityKind))
        .map(byLabel -> byLabel.get(label));
  }

  /**
   * Finds all definitions of an entity kind, ordered by label.
   *
   * @param entityKind node or edge
   * @return the definitions
   */
  public List<TypeDefinition> findAll(EntityKind entityKind) {
    return Optional.ofNullable(definitions.get(entityKind))
        .map(byLabel -> byLabel.values().stream()
            .sorted(Comparator.comparing(TypeDefinition::label))
            .toList())
        .orElse(List.of());
  }

  /**
   * Saves a definition, replacing any previous definition of the same key.
   *
   * @param definition the definition
   * @return the saved definition
   */
  public TypeDefinition save(TypeDefinition definition) {
    definitions.computeIfAbsent(definition.entityKind(), k -> new ConcurrentHashMap<>())
        .put(definition.label(), definition);
    return definition;
  }

  /**
   * Saves definitions in order, so a later definition of the same key wins.
   *
   * @param batch the definitions
   */
  public void saveAll(Collection<TypeDefinition> batch) {
    batch.forEach(this::save);
  }

  /**
   * Counts registered definitions.
   *
   * @return number of definitions across both entity kinds
   */
  public int count() {
    return definitions.values().stream().mapToInt(Map::size).sum();
  }
}
