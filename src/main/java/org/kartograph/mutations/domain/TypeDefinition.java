package org.kartograph.mutations.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Declared schema of a node or edge label.
 * Keyed by {@code (entityKind, label)}; a later definition of the same key replaces the earlier.
 *
 * @param entityKind node or edge
 * @param label the type label
 * @param description plain-text description of the type
 * @param requiredProperties properties every instance is expected to carry, in declaration order
 * @param optionalProperties properties instances may carry, in declaration order
 * @param exampleFilePath source file showing an instance of the type
 * @param exampleInFilePath the instance as it appears in that file
 */
public record TypeDefinition(
    @JsonProperty("entity_type") EntityKind entityKind,
    String label,
    String description,
    @JsonProperty("required_properties") Set<String> requiredProperties,
    @JsonProperty("optional_properties") Set<String> optionalProperties,
    @JsonProperty("example_file_path") String exampleFilePath,
    @JsonProperty("example_in_file_path") String exampleInFilePath) {

  /**
   * Creates a type definition with defensive copies of the property sets.
   *
   * @throws NullPointerException if entity kind or label is null
   * @throws IllegalArgumentException if label is blank
   */
  public TypeDefinition {
    Objects.requireNonNull(entityKind, "Entity kind cannot be null");
    Objects.requireNonNull(label, "Label cannot be null");
    if (label.isBlank()) {
      throw new IllegalArgumentException("Label cannot be blank");
    }
    description = description != null ? description : "";
    requiredProperties = orderedCopy(requiredProperties);
    optionalProperties = orderedCopy(optionalProperties);
    exampleFilePath = exampleFilePath != null ? exampleFilePath : "";
    exampleInFilePath = exampleInFilePath != null ? exampleInFilePath : "";
  }

  /**
   * Creates a type definition without examples.
   *
   * @param entityKind node or edge
   * @param label the type label
   * @param description plain-text description of the type
   * @param requiredProperties required properties
   * @param optionalProperties optional properties
   */
  public TypeDefinition(
      EntityKind entityKind,
      String label,
      String description,
      Set<String> requiredProperties,
      Set<String> optionalProperties) {
    this(entityKind, label, description, requiredProperties, optionalProperties, null, null);
  }

  private static Set<String> orderedCopy(Set<String> properties) {
    return properties != null
        ? Collections.unmodifiableSet(new LinkedHashSet<>(properties))
        : Set.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable set created in constructor")
  @Override
  public Set<String> requiredProperties() {
    return requiredProperties;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable set created in constructor")
  @Override
  public Set<String> optionalProperties() {
    return optionalProperties;
  }

  /**
   * Checks whether this definition mentions a property, as required or optional.
   *
   * @param property the property name
   * @return true if the property is declared
   */
  public boolean declares(String property) {
    return requiredProperties.contains(property) || optionalProperties.contains(property);
  }
}
