package org.kartograph.mutations.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for BatchError.
 */
class BatchErrorTest {

  @Test
  void message_shouldOmitOperation_forParseErrors() {
    assertThat(BatchError.parse(5, "invalid syntax").message())
        .isEqualTo("Line 5: invalid syntax");
  }

  @Test
  void message_shouldIncludeOperation_forStructuralErrors() {
    BatchError error = new BatchError(
        BatchError.Category.STRUCTURAL, 3, 2, "CREATE requires 'label'");

    assertThat(error.message()).isEqualTo("Line 3 (operation 2): CREATE requires 'label'");
    assertThat(error).hasToString(error.message());
  }
}
