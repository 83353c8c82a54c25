package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.kartograph.mutations.util.PropertyMaps;

/**
 * CREATE: idempotent upsert of a node or edge by id.
 *
 * @param index batch index
 * @param span source lines
 * @param entityKind node or edge
 * @param id entity id (null when absent)
 * @param label entity label (null when absent)
 * @param startId source node id of an edge (null when absent)
 * @param endId target node id of an edge (null when absent)
 * @param setProperties properties to write (null when the line carries none)
 * @param extraneousFields fields on the line a CREATE does not use
 */
public record CreateOperation(
    int index,
    LineSpan span,
    EntityKind entityKind,
    String id,
    String label,
    String startId,
    String endId,
    Map<String, Object> setProperties,
    Set<String> extraneousFields) implements MutationOperation {

  /**
   * Creates a CREATE operation with defensive copies.
   */
  public CreateOperation {
    Objects.requireNonNull(span, "Span cannot be null");
    Objects.requireNonNull(entityKind, "Entity kind cannot be null");
    setProperties = setProperties != null ? PropertyMaps.immutableCopy(setProperties) : null;
    extraneousFields = extraneousFields != null ? Set.copyOf(extraneousFields) : Set.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable map created in constructor")
  @Override
  public Map<String, Object> setProperties() {
    return setProperties;
  }

  @Override
  public OperationKind kind() {
    return OperationKind.CREATE;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitCreate(this);
  }
}
