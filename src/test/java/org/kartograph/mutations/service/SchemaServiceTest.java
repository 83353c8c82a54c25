package org.kartograph.mutations.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.TypeDefinition;
import org.kartograph.mutations.exception.TypeDefinitionNotFoundException;
import org.kartograph.mutations.repository.TypeDefinitionRepository;

/**
 * Unit tests for SchemaService.
 */
class SchemaServiceTest {

  private SchemaService service;

  @BeforeEach
  void setUp() {
    TypeDefinitionRepository registry = new TypeDefinitionRepository();
    registry.save(new TypeDefinition(EntityKind.NODE, "person", "A human being",
        Set.of("name"), Set.of("email")));
    registry.save(new TypeDefinition(EntityKind.NODE, "company", "A business",
        Set.of("name"), null));
    registry.save(new TypeDefinition(EntityKind.EDGE, "works_at", "Employment of a person",
        null, Set.of("since")));
    service = new SchemaService(registry);
  }

  @Test
  void list_shouldReturnAllOfKind_orderedByLabel() {
    assertThat(service.list(EntityKind.NODE, null, null))
        .extracting(TypeDefinition::label)
        .containsExactly("company", "person");
  }

  @Test
  void list_shouldSearchLabelAndDescription_caseInsensitively() {
    assertThat(service.list(EntityKind.NODE, "HUMAN", null))
        .extracting(TypeDefinition::label).containsExactly("person");
    assertThat(service.list(EntityKind.NODE, "comp", null))
        .extracting(TypeDefinition::label).containsExactly("company");
    assertThat(service.list(EntityKind.EDGE, "person", null))
        .extracting(TypeDefinition::label).containsExactly("works_at");
  }

  @Test
  void list_shouldFilterByDeclaredProperty() {
    assertThat(service.list(EntityKind.NODE, null, "email"))
        .extracting(TypeDefinition::label).containsExactly("person");
    assertThat(service.list(EntityKind.NODE, " ", "name")).hasSize(2);
  }

  @Test
  void get_shouldThrow_whenLabelIsUnknown() {
    assertThatThrownBy(() -> service.get(EntityKind.EDGE, "person"))
        .isInstanceOf(TypeDefinitionNotFoundException.class)
        .hasMessage("No edge type definition for label: person");
  }
}
