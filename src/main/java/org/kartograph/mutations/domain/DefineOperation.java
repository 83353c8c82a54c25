package org.kartograph.mutations.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DEFINE: declares or replaces the type definition of a label.
 *
 * @param index batch index
 * @param span source lines
 * @param entityKind node or edge
 * @param label the type label (null when the line lacks one)
 * @param description type description (null when absent)
 * @param requiredProperties required property names, in line order
 * @param optionalProperties optional property names, in line order
 * @param exampleFilePath source file showing an instance of the type (null when absent)
 * @param exampleInFilePath the instance as it appears in that file (null when absent)
 * @param extraneousFields fields on the line a DEFINE does not use
 */
public record DefineOperation(
    int index,
    LineSpan span,
    EntityKind entityKind,
    String label,
    String description,
    List<String> requiredProperties,
    List<String> optionalProperties,
    String exampleFilePath,
    String exampleInFilePath,
    Set<String> extraneousFields) implements MutationOperation {

  /**
   * Creates a DEFINE operation with defensive copies.
   */
  public DefineOperation {
    Objects.requireNonNull(span, "Span cannot be null");
    Objects.requireNonNull(entityKind, "Entity kind cannot be null");
    requiredProperties = requiredProperties != null ? List.copyOf(requiredProperties) : List.of();
    optionalProperties = optionalProperties != null ? List.copyOf(optionalProperties) : List.of();
    extraneousFields = extraneousFields != null ? Set.copyOf(extraneousFields) : Set.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<String> requiredProperties() {
    return requiredProperties;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns immutable list created in constructor")
  @Override
  public List<String> optionalProperties() {
    return optionalProperties;
  }

  @Override
  public OperationKind kind() {
    return OperationKind.DEFINE;
  }

  @Override
  public String id() {
    return null;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitDefine(this);
  }

  /**
   * Converts this operation to the type definition it declares.
   *
   * @return the type definition
   * @throws IllegalStateException if the operation has no label
   */
  public TypeDefinition toTypeDefinition() {
    if (label == null || label.isBlank()) {
      throw new IllegalStateException("DEFINE at index " + index + " has no label");
    }
    return new TypeDefinition(
        entityKind,
        label,
        description,
        new LinkedHashSet<>(requiredProperties),
        new LinkedHashSet<>(optionalProperties),
        exampleFilePath,
        exampleInFilePath);
  }
}
