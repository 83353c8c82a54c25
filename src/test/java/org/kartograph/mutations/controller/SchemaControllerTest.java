package org.kartograph.mutations.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.kartograph.mutations.domain.EntityKind;
import org.kartograph.mutations.domain.TypeDefinition;
import org.kartograph.mutations.exception.TypeDefinitionNotFoundException;
import org.kartograph.mutations.service.SchemaService;
import org.kartograph.mutations.testutil.TestMeterRegistryConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for SchemaController.
 */
@WebMvcTest(SchemaController.class)
@Import(TestMeterRegistryConfig.class)
class SchemaControllerTest {

  private static final TypeDefinition PERSON = new TypeDefinition(
      EntityKind.NODE, "person", "A human being", Set.of("name"), Set.of(),
      "people/alice.md", "name: Alice Smith");

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private SchemaService schemaService;

  @Test
  void listNodeTypes_shouldPassFilters_andReturnCount() throws Exception {
    // Given
    when(schemaService.list(EntityKind.NODE, "hum", "name")).thenReturn(List.of(PERSON));

    // When / Then
    mockMvc.perform(get("/graph/schema/nodes")
            .param("search", "hum")
            .param("has_property", "name"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.definitions[0].label").value("person"))
        .andExpect(jsonPath("$.definitions[0].entity_type").value("node"))
        .andExpect(jsonPath("$.definitions[0].required_properties[0]").value("name"));
  }

  @Test
  void listEdgeTypes_shouldReturnEmptyList() throws Exception {
    // Given
    when(schemaService.list(EntityKind.EDGE, null, null)).thenReturn(List.of());

    // When / Then
    mockMvc.perform(get("/graph/schema/edges"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(0))
        .andExpect(jsonPath("$.definitions").isEmpty());
  }

  @Test
  void getNodeType_shouldReturnDefinition() throws Exception {
    // Given
    when(schemaService.get(EntityKind.NODE, "person")).thenReturn(PERSON);

    // When / Then
    mockMvc.perform(get("/graph/schema/nodes/{label}", "person"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.description").value("A human being"))
        .andExpect(jsonPath("$.example_file_path").value("people/alice.md"))
        .andExpect(jsonPath("$.example_in_file_path").value("name: Alice Smith"));
  }

  @Test
  void getEdgeType_shouldReturnEmptyExamples_whenNoneWereDefined() throws Exception {
    // Given
    when(schemaService.get(EntityKind.EDGE, "knows")).thenReturn(
        new TypeDefinition(EntityKind.EDGE, "knows", "Acquaintance", null, null));

    // When / Then
    mockMvc.perform(get("/graph/schema/edges/{label}", "knows"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.example_file_path").value(""))
        .andExpect(jsonPath("$.example_in_file_path").value(""));
  }

  @Test
  void getEdgeType_shouldReturn404_whenUndefined() throws Exception {
    // Given
    when(schemaService.get(EntityKind.EDGE, "knows"))
        .thenThrow(new TypeDefinitionNotFoundException(EntityKind.EDGE, "knows"));

    // When / Then
    mockMvc.perform(get("/graph/schema/edges/{label}", "knows"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("type_definition_not_found"))
        .andExpect(jsonPath("$.title").value("No edge type definition for label: knows"));
  }
}
