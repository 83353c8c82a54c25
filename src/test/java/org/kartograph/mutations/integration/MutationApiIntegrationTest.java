package org.kartograph.mutations.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kartograph.mutations.testutil.MutationLines.ALICE;
import static org.kartograph.mutations.testutil.MutationLines.BOB;
import static org.kartograph.mutations.testutil.MutationLines.KNOWS;
import static org.kartograph.mutations.testutil.MutationLines.batch;
import static org.kartograph.mutations.testutil.MutationLines.createEdge;
import static org.kartograph.mutations.testutil.MutationLines.createNode;
import static org.kartograph.mutations.testutil.MutationLines.defineEdge;
import static org.kartograph.mutations.testutil.MutationLines.defineNode;
import static org.kartograph.mutations.testutil.MutationLines.delete;
import static org.kartograph.mutations.testutil.MutationLines.update;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kartograph.mutations.domain.MutationResult;
import org.kartograph.mutations.repository.InMemoryGraphStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

/**
 * End-to-end tests for batch submission and graph reads over HTTP.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class MutationApiIntegrationTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Autowired
  private InMemoryGraphStore graphStore;

  @BeforeEach
  void setUp() {
    graphStore.clear();
  }

  private ResponseEntity<MutationResult> submit(String jsonl) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.valueOf("application/jsonl"));
    return restTemplate.postForEntity(
        "/graph/mutations", new HttpEntity<>(jsonl, headers), MutationResult.class);
  }

  @Test
  void submit_shouldCommitBatch_andExposeGraph() {
    // When
    ResponseEntity<MutationResult> response = submit(batch(
        defineNode("person", "\"name\""),
        defineEdge("knows"),
        createNode(ALICE, "person", "Alice"),
        createNode(BOB, "person", "Bob"),
        createEdge(KNOWS, "knows", ALICE, BOB)));

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo(MutationResult.committed(5));

    ResponseEntity<JsonNode> neighbors = restTemplate.getForEntity(
        "/graph/nodes/{id}/neighbors", JsonNode.class, ALICE);
    assertThat(neighbors.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(neighbors.getBody().path("neighbors").get(0).path("id").asText())
        .isEqualTo(BOB);
    assertThat(neighbors.getBody().path("node").path("properties").path("graph_id").asText())
        .isEqualTo("kartograph");

    ResponseEntity<JsonNode> schema = restTemplate.getForEntity(
        "/graph/schema/nodes/{label}", JsonNode.class, "person");
    assertThat(schema.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(schema.getBody().path("required_properties").get(0).asText()).isEqualTo("name");
  }

  @Test
  void submit_shouldRejectWholeBatch_whenOneLineIsInvalid() {
    // When
    ResponseEntity<MutationResult> response = submit(batch(
        createNode(ALICE, "person", "Alice"),
        "{\"op\":\"CREATE\",\"type\":\"node\""));

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().operationsApplied()).isZero();
    assertThat(response.getBody().errors()).containsExactly("Line 2: invalid syntax");
    assertThat(graphStore.nodeCount()).isZero();
  }

  @Test
  void submit_shouldRollBack_whenOperationFailsDuringApply() {
    // When
    ResponseEntity<MutationResult> response = submit(batch(
        createNode(ALICE, "person", "Alice"),
        update("node", BOB, "\"a\":1", "")));

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().errors())
        .containsExactly("Operation 1 (line 2) UPDATE: node '" + BOB + "' does not exist");
    ResponseEntity<JsonNode> node = restTemplate.getForEntity(
        "/graph/nodes/{id}", JsonNode.class, ALICE);
    assertThat(node.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(node.getBody().path("code").asText()).isEqualTo("entity_not_found");
  }

  @Test
  void submit_shouldCascadeDelete_toIncidentEdges() {
    // Given
    submit(batch(
        createNode(ALICE, "person", "Alice"),
        createNode(BOB, "person", "Bob"),
        createEdge(KNOWS, "knows", ALICE, BOB)));

    // When
    ResponseEntity<MutationResult> response = submit(delete("node", ALICE));

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(restTemplate.getForEntity("/graph/edges/{id}", JsonNode.class, KNOWS)
        .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void submit_shouldCommitNothing_forEmptyBody() {
    // When
    ResponseEntity<MutationResult> response = submit("# nothing yet\n\n");

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo(MutationResult.committed(0));
  }

  @Test
  void validate_shouldReportWarnings_withoutApplying() {
    // Given
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.TEXT_PLAIN);

    // When
    ResponseEntity<JsonNode> response = restTemplate.postForEntity("/graph/mutations/validate",
        new HttpEntity<>(createNode(ALICE, "undeclared_label", "Alice"), headers),
        JsonNode.class);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().path("submittable").asBoolean()).isTrue();
    assertThat(response.getBody().path("warning_count").asInt()).isGreaterThan(0);
    assertThat(graphStore.nodeCount()).isZero();
  }

  @Test
  void response_shouldEchoCorrelationId() {
    // Given
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Correlation-ID", "it-run-1");

    // When
    ResponseEntity<String> response = restTemplate.exchange("/graph/schema/edges",
        org.springframework.http.HttpMethod.GET, new HttpEntity<>(headers), String.class);

    // Then
    assertThat(response.getHeaders().getFirst("X-Correlation-ID")).isEqualTo("it-run-1");
  }

  @Test
  void health_shouldReportGraphStore() {
    // When
    ResponseEntity<JsonNode> response =
        restTemplate.getForEntity("/actuator/health", JsonNode.class);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().path("components").path("graphStore").path("status").asText())
        .isEqualTo("UP");
  }
}
