package org.kartograph.mutations.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for CorrelationIdFilter.
 */
class CorrelationIdFilterTest {

  private final CorrelationIdFilter filter = new CorrelationIdFilter();

  private String runFilter(MockHttpServletRequest request, MockHttpServletResponse response)
      throws Exception {
    AtomicReference<String> seen = new AtomicReference<>();
    MockFilterChain chain = new MockFilterChain() {
      @Override
      public void doFilter(jakarta.servlet.ServletRequest req,
                           jakarta.servlet.ServletResponse res) {
        seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
      }
    };
    filter.doFilter(request, response, chain);
    return seen.get();
  }

  @Test
  void doFilter_shouldGenerateId_andClearMdcAfterwards() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/graph/nodes/x");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    String seen = runFilter(request, response);

    // Then
    assertThat(seen).isNotBlank();
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo(seen);
    assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)).isNull();
  }

  @Test
  void doFilter_shouldReuseIncomingId() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/graph/mutations");
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "editor-42");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    String seen = runFilter(request, response);

    // Then
    assertThat(seen).isEqualTo("editor-42");
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .isEqualTo("editor-42");
  }

  @Test
  void doFilter_shouldReplaceOverlongIncomingId() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/graph/schema/nodes");
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "x".repeat(65));
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    String seen = runFilter(request, response);

    // Then
    assertThat(seen).hasSize(36);
  }
}
