package org.kartograph.mutations.domain;

import java.util.Objects;
import java.util.Set;

/**
 * DELETE: removes an entity; deleting a node also removes its incident edges.
 *
 * @param index batch index
 * @param span source lines
 * @param entityKind node or edge
 * @param id entity id (null when absent)
 * @param extraneousFields fields on the line a DELETE does not use
 */
public record DeleteOperation(
    int index,
    LineSpan span,
    EntityKind entityKind,
    String id,
    Set<String> extraneousFields) implements MutationOperation {

  /**
   * Creates a DELETE operation.
   */
  public DeleteOperation {
    Objects.requireNonNull(span, "Span cannot be null");
    Objects.requireNonNull(entityKind, "Entity kind cannot be null");
    extraneousFields = extraneousFields != null ? Set.copyOf(extraneousFields) : Set.of();
  }

  @Override
  public OperationKind kind() {
    return OperationKind.DELETE;
  }

  @Override
  public String label() {
    return null;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitDelete(this);
  }
}
