package org.kartograph.mutations.domain;

import java.util.Set;

/**
 * One decoded mutation line.
 * Closed set of variants; consumers dispatch through {@link Visitor} so that adding a variant
 * fails compilation wherever it is not handled.
 */
public sealed interface MutationOperation
    permits DefineOperation, CreateOperation, UpdateOperation, DeleteOperation {

  /**
   * Returns the 0-based position of this operation in its batch (blank, comment and
   * undecodable lines are not counted).
   *
   * @return the batch index
   */
  int index();

  /**
   * Returns the input lines this operation was decoded from.
   *
   * @return the line span
   */
  LineSpan span();

  /**
   * Returns the targeted entity kind.
   *
   * @return node or edge
   */
  EntityKind entityKind();

  /**
   * Returns the operation discriminator.
   *
   * @return the operation kind
   */
  OperationKind kind();

  /**
   * Returns the entity id, or null when the line carries none.
   *
   * @return the id or null
   */
  String id();

  /**
   * Returns the label, or null for variants or lines without one.
   *
   * @return the label or null
   */
  String label();

  /**
   * Returns fields present on the line that the variant does not use.
   *
   * @return unmodifiable set of field names
   */
  Set<String> extraneousFields();

  /**
   * Dispatches to the visitor method of this variant.
   *
   * @param visitor the visitor
   * @param <R> result type
   * @return the visitor's result
   */
  <R> R accept(Visitor<R> visitor);

  /**
   * Exhaustive handler over all operation variants.
   *
   * @param <R> result type
   */
  interface Visitor<R> {

    R visitDefine(DefineOperation operation);

    R visitCreate(CreateOperation operation);

    R visitUpdate(UpdateOperation operation);

    R visitDelete(DeleteOperation operation);
  }
}
