package org.kartograph.mutations.filter;

import com.github.f4b6a3.uuid.UuidCreator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that tags each HTTP request with a correlation ID.
 * The ID is put into the SLF4J MDC for the request's log lines and echoed in the
 * {@value #CORRELATION_ID_HEADER} response header. A caller-supplied header value is reused.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

  /**
   * MDC key for correlation ID (used in the logging pattern).
   */
  public static final String CORRELATION_ID_KEY = "correlationId";

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  private static final int MAX_INCOMING_LENGTH = 64;

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String correlationId = request.getHeader(CORRELATION_ID_HEADER);
    if (correlationId == null || correlationId.isBlank()
        || correlationId.length() > MAX_INCOMING_LENGTH) {
      // UUIDv7, time-ordered
      correlationId = UuidCreator.getTimeOrderedEpoch().toString();
    }

    MDC.put(CORRELATION_ID_KEY, correlationId);
    response.setHeader(CORRELATION_ID_HEADER, correlationId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }
}
