package org.kartograph.mutations.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.kartograph.mutations.testutil.MutationLines.createNode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kartograph.mutations.config.ParseDispatcherProperties;
import org.kartograph.mutations.domain.ParseState;
import org.kartograph.mutations.dto.ParsePreview;
import org.kartograph.mutations.dto.ParseSessionView;
import org.kartograph.mutations.dto.ParseTicket;
import org.kartograph.mutations.dto.PreviewMode;
import org.kartograph.mutations.exception.ParseSessionNotFoundException;
import org.kartograph.mutations.testutil.TestParsers;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Unit tests for ParseDispatcher with real executors.
 */
class ParseDispatcherTest {

  private ParseDispatcherProperties properties;
  private ThreadPoolTaskExecutor executor;
  private ThreadPoolTaskScheduler scheduler;
  private SimpleMeterRegistry meterRegistry;
  private ParseDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    properties = new ParseDispatcherProperties();
    properties.setBackgroundThreshold(200);
    properties.setSummaryThreshold(2000);
    properties.setDebounceSmallMs(20);
    properties.setPreviewLimit(3);
    properties.setSummaryErrorLimit(2);

    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.initialize();
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.initialize();
    meterRegistry = new SimpleMeterRegistry();

    dispatcher = newDispatcher(TestParsers.batchParser(), executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
    scheduler.shutdown();
  }

  private ParseDispatcher newDispatcher(MutationBatchParser parser, TaskExecutor taskExecutor) {
    return new ParseDispatcher(parser, new ParsePreviewAssembler(properties), properties,
        taskExecutor, scheduler, meterRegistry);
  }

  private static String nodes(int count) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; i++) {
      text.append(createNode(String.format("person:%016x", i), "person", "P" + i)).append('\n');
    }
    return text.toString();
  }

  private ParseSessionView awaitSettled(String sessionId) {
    await().atMost(Duration.ofSeconds(5)).until(
        () -> dispatcher.view(sessionId).state() != ParseState.PARSING);
    return dispatcher.view(sessionId);
  }

  @Test
  void submit_shouldParseSynchronously_whenInputIsSmall() {
    // When
    ParseTicket ticket = dispatcher.submit("s1", "{\"op\":\"DELETE\"}");

    // Then
    assertThat(ticket.state()).isEqualTo(ParseState.READY);
    assertThat(ticket.sequence()).isEqualTo(1);
    assertThat(ticket.debounceMs()).isZero();
    assertThat(ticket.result().errors()).containsExactly("Line 1: DELETE requires 'type'");
    assertThat(ticket.result().submittable()).isFalse();
    assertThat(dispatcher.view("s1").result()).isEqualTo(ticket.result());
  }

  @Test
  void submit_shouldParseInBackground_andCapOperations_whenInputIsLarge() {
    // Given
    String text = nodes(5);

    // When
    ParseTicket ticket = dispatcher.submit("s1", text);

    // Then
    assertThat(ticket.state()).isEqualTo(ParseState.PARSING);
    assertThat(ticket.debounceMs()).isEqualTo(20);
    assertThat(ticket.result()).isNull();
    ParseSessionView view = awaitSettled("s1");
    assertThat(view.state()).isEqualTo(ParseState.READY);
    ParsePreview preview = view.result();
    assertThat(preview.mode()).isEqualTo(PreviewMode.FULL);
    assertThat(preview.operations()).hasSize(3);
    assertThat(preview.operationsTruncated()).isTrue();
    assertThat(preview.breakdown().create()).isEqualTo(5);
  }

  @Test
  void submit_shouldReturnSummary_whenInputExceedsSummaryThreshold() {
    // Given
    String text = "bad\n" + nodes(20) + "worse\n{\"op\":\"NOPE\"}\n";

    // When
    dispatcher.submit("s1", text);

    // Then
    ParsePreview preview = awaitSettled("s1").result();
    assertThat(preview.mode()).isEqualTo(PreviewMode.SUMMARY);
    assertThat(preview.breakdown().create()).isEqualTo(20);
    assertThat(preview.breakdown().unknown()).isEqualTo(3);
    assertThat(preview.errors()).hasSize(2);
    assertThat(preview.errorCount()).isEqualTo(3);
    assertThat(preview.warnings()).isEmpty();
    assertThat(preview.operations()).isEmpty();
    assertThat(preview.submittable()).isFalse();
  }

  @Test
  void submit_shouldOnlyShowLatestResult_whenRequestsOverlap() {
    // Given
    properties.setDebounceSmallMs(200);

    // When
    ParseTicket first = dispatcher.submit("s1", nodes(5));
    ParseTicket second = dispatcher.submit("s1", nodes(4));

    // Then
    assertThat(second.sequence()).isGreaterThan(first.sequence());
    ParseSessionView latest = awaitSettled("s1");
    assertThat(latest.sequence()).isEqualTo(second.sequence());
    assertThat(latest.result().breakdown().create()).isEqualTo(4);
    ParseSessionView stale = dispatcher.view("s1", first.sequence());
    assertThat(stale.state()).isEqualTo(ParseState.SUPERSEDED);
    assertThat(stale.result()).isNull();
  }

  @Test
  void submit_shouldSupersedePendingBackgroundParse_whenSmallInputFollows() {
    // Given
    properties.setDebounceSmallMs(200);
    ParseTicket background = dispatcher.submit("s1", nodes(5));

    // When
    ParseTicket sync = dispatcher.submit("s1", "");

    // Then
    assertThat(sync.state()).isEqualTo(ParseState.READY);
    assertThat(dispatcher.view("s1", background.sequence()).state())
        .isEqualTo(ParseState.SUPERSEDED);
    await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(
        () -> dispatcher.view("s1").sequence() == sync.sequence()
            && dispatcher.view("s1").state() == ParseState.READY);
  }

  @Test
  void submit_shouldFail_whenExecutorRejects() {
    // Given
    TaskExecutor rejecting = task -> {
      throw new TaskRejectedException("queue full");
    };
    dispatcher = newDispatcher(TestParsers.batchParser(), rejecting);

    // When
    dispatcher.submit("s1", nodes(5));

    // Then
    ParseSessionView view = awaitSettled("s1");
    assertThat(view.state()).isEqualTo(ParseState.FAILED);
    assertThat(view.failure()).isEqualTo("parse queue is full; submit again");
    assertThat(view.result()).isNull();
  }

  @Test
  void submit_shouldFail_whenParserThrows() {
    // Given
    MutationBatchParser failing = mock(MutationBatchParser.class);
    when(failing.parse(anyString())).thenThrow(new IllegalStateException("boom"));
    dispatcher = newDispatcher(failing, executor);

    // When
    dispatcher.submit("s1", nodes(5));

    // Then
    ParseSessionView view = awaitSettled("s1");
    assertThat(view.state()).isEqualTo(ParseState.FAILED);
    assertThat(view.failure()).isEqualTo("parse failed: boom");
  }

  @Test
  void submit_shouldRejectInvalidSessionIds() {
    assertThatThrownBy(() -> dispatcher.submit(" ", ""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Session id cannot be blank");
    assertThatThrownBy(() -> dispatcher.submit("x".repeat(129), ""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("128");
  }

  @Test
  void view_shouldThrow_whenSessionIsUnknown() {
    assertThatThrownBy(() -> dispatcher.view("missing"))
        .isInstanceOf(ParseSessionNotFoundException.class)
        .hasMessage("Parse session not found: missing");
  }

  @Test
  void view_shouldThrow_whenSequenceWasNeverIssued() {
    // Given
    dispatcher.submit("s1", "");

    // When / Then
    assertThatThrownBy(() -> dispatcher.view("s1", 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Sequence 2 was not issued in session s1");
  }

  @Test
  void close_shouldForgetSession() {
    // Given
    dispatcher.submit("s1", "");
    dispatcher.submit("s2", "");
    assertThat(dispatcher.sessionCount()).isEqualTo(2);

    // When
    dispatcher.close("s1");

    // Then
    assertThatThrownBy(() -> dispatcher.view("s1"))
        .isInstanceOf(ParseSessionNotFoundException.class);
    assertThat(dispatcher.view("s2").state()).isEqualTo(ParseState.READY);
    assertThat(dispatcher.sessionCount()).isEqualTo(1);
    assertThat(meterRegistry.get("kartograph.parse.requests")
        .tag("path", "sync").counter().count()).isEqualTo(2.0);
  }
}
