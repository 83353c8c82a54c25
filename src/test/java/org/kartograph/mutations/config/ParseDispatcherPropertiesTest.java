package org.kartograph.mutations.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ParseDispatcherProperties.
 */
class ParseDispatcherPropertiesTest {

  @Test
  void debounceFor_shouldGrowWithInputSize() {
    // Given
    ParseDispatcherProperties properties = new ParseDispatcherProperties();

    // Then
    assertThat(properties.debounceFor(100_001)).isEqualTo(300);
    assertThat(properties.debounceFor(1_000_000)).isEqualTo(300);
    assertThat(properties.debounceFor(1_000_001)).isEqualTo(500);
    assertThat(properties.debounceFor(10_000_000)).isEqualTo(500);
    assertThat(properties.debounceFor(10_000_001)).isEqualTo(1000);
  }

  @Test
  void defaults_shouldKeepSummaryThresholdAboveBackgroundThreshold() {
    ParseDispatcherProperties properties = new ParseDispatcherProperties();

    assertThat(properties.getSummaryThreshold())
        .isGreaterThan(properties.getBackgroundThreshold());
  }
}
