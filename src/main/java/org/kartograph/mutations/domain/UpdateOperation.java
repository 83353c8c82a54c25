package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.kartograph.mutations.util.PropertyMaps;

/**
 * UPDATE: partial update of an existing entity. Sets are applied before removals.
 *
 * @param index batch index
 * @param span source lines
 * @param entityKind node or edge
 * @param id entity id (null when absent)
 * @param setProperties properties to overwrite (null when absent)
 * @param removeProperties properties to delete, in line order (null when absent)
 * @param extraneousFields fields on the line an UPDATE does not use
 */
public record UpdateOperation(
    int index,
    LineSpan span,
    EntityKind entityKind,
    String id,
    Map<String, Object> setProperties,
    List<String> removeProperties,
    Set<String> extraneousFields) implements MutationOperation {

  /**
   * Creates an UPDATE operation with defensive copies.
   */
  public UpdateOperation {
    Objects.requireNonNull(span, "Span cannot be null");
    Objects.requireNonNull(entityKind, "Entity kind cannot be null");
    setProperties = setProperties != null ? PropertyMaps.immutableCopy(setProperties) : null;
    removeProperties = removeProperties != null ? List.copyOf(removeProperties) : null;
    extraneousFields = extraneousFields != null ? Set.copyOf(extraneousFields) : Set.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable map created in constructor")
  @Override
  public Map<String, Object> setProperties() {
    return setProperties;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<String> removeProperties() {
    return removeProperties;
  }

  @Override
  public OperationKind kind() {
    return OperationKind.UPDATE;
  }

  @Override
  public String label() {
    return null;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitUpdate(this);
  }
}
