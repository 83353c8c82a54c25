package org.kartograph.mutations.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.kartograph.mutations.config.ParseDispatcherProperties;
import org.kartograph.mutations.domain.ParseState;
import org.kartograph.mutations.domain.ParsedBatch;
import org.kartograph.mutations.dto.ParsePreview;
import org.kartograph.mutations.dto.ParseSessionView;
import org.kartograph.mutations.dto.ParseTicket;
import org.kartograph.mutations.exception.ParseSessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Live parse feedback for batches being edited.
 *
 * <p>Small inputs are parsed on the calling thread. Inputs above the background threshold
 * are debounced and then parsed on the parse executor; each request carries an immutable copy
 * of the text and yields an immutable preview. A newer request supersedes older ones: a
 * debounced request that has not started is cancelled, and a result whose request is no
 * longer the latest is dropped on arrival. Inputs above the summary threshold get a read-only
 * breakdown instead of full linting.
 */
@Service
public class ParseDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ParseDispatcher.class);

  private static final int MAX_SESSION_ID_LENGTH = 128;

  private final MutationBatchParser parser;
  private final ParsePreviewAssembler assembler;
  private final ParseDispatcherProperties properties;
  private final TaskExecutor parseExecutor;
  private final TaskScheduler parseScheduler;
  private final MeterRegistry meterRegistry;
  private final Cache<String, ParseSession> sessions;

  /**
   * Constructs a ParseDispatcher.
   *
   * @param parser the shared parse pipeline
   * @param assembler the preview assembler
   * @param properties thresholds and limits
   * @param parseExecutor worker pool for background parses
   * @param parseScheduler scheduler for debouncing
   * @param meterRegistry the meter registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public ParseDispatcher(
      MutationBatchParser parser,
      ParsePreviewAssembler assembler,
      ParseDispatcherProperties properties,
      @Qualifier("parseExecutor") TaskExecutor parseExecutor,
      @Qualifier("parseScheduler") TaskScheduler parseScheduler,
      MeterRegistry meterRegistry) {
    this.parser = parser;
    this.assembler = assembler;
    this.properties = properties;
    this.parseExecutor = parseExecutor;
    this.parseScheduler = parseScheduler;
    this.meterRegistry = meterRegistry;
    this.sessions = Caffeine.newBuilder()
        .expireAfterAccess(properties.getSessionTtlMinutes(), TimeUnit.MINUTES)
        .maximumSize(properties.getMaxSessions())
        .removalListener((String key, ParseSession session, RemovalCause cause) -> {
          if (session != null) {
            session.replacePending(null);
          }
          logger.debug("Dropped parse session {} ({})", key, cause);
        })
        .recordStats()
        .build();
  }

  /**
   * Registers cache metrics for the session cache.
   */
  @PostConstruct
  public void initializeMetrics() {
    CaffeineCacheMetrics.monitor(meterRegistry, sessions, "parse_sessions");
  }

  /**
   * Submits the current text of an editing session for parsing.
   *
   * @param sessionId the editing session (created on first use)
   * @param text the full batch text
   * @return READY with the result on the synchronous path, PARSING on the background path
   * @throws IllegalArgumentException if the session id is blank or too long
   */
  public ParseTicket submit(String sessionId, String text) {
    validateSessionId(sessionId);
    String input = text != null ? text : "";
    ParseSession session = sessions.get(sessionId, ParseSession::new);
    long sequence = session.issue();

    if (input.length() <= properties.getBackgroundThreshold()) {
      session.replacePending(null);
      meterRegistry.counter("kartograph.parse.requests", "path", "sync").increment();
      ParsePreview preview = compute(input, Integer.MAX_VALUE);
      if (!session.offer(sequence, preview)) {
        discard(session, sequence);
        return new ParseTicket(sessionId, sequence, ParseState.SUPERSEDED, 0, null);
      }
      return new ParseTicket(sessionId, sequence, ParseState.READY, 0, preview);
    }

    meterRegistry.counter("kartograph.parse.requests", "path", "background").increment();
    long debounceMs = properties.debounceFor(input.length());
    ScheduledFuture<?> future = parseScheduler.schedule(
        () -> startBackground(session, sequence, input),
        Instant.now().plusMillis(debounceMs));
    session.replacePending(future);
    logger.debug("Scheduled background parse {} of session {} ({} chars, debounce {} ms)",
        sequence, sessionId, input.length(), debounceMs);
    return new ParseTicket(sessionId, sequence, ParseState.PARSING, debounceMs, null);
  }

  /**
   * Returns the state of the latest request of a session.
   *
   * @param sessionId the editing session
   * @return the session view
   * @throws ParseSessionNotFoundException if the session is unknown or expired
   */
  public ParseSessionView view(String sessionId) {
    ParseSession session = requireSession(sessionId);
    return view(session, session.latestIssued());
  }

  /**
   * Returns the state of one request of a session.
   *
   * @param sessionId the editing session
   * @param sequence the request sequence
   * @return the session view
   * @throws ParseSessionNotFoundException if the session is unknown or expired
   * @throws IllegalArgumentException if the sequence was never issued
   */
  public ParseSessionView view(String sessionId, long sequence) {
    ParseSession session = requireSession(sessionId);
    if (sequence < 1 || sequence > session.latestIssued()) {
      throw new IllegalArgumentException(
          "Sequence " + sequence + " was not issued in session " + sessionId);
    }
    return view(session, sequence);
  }

  /**
   * Ends an editing session, cancelling a pending debounced parse.
   *
   * @param sessionId the editing session
   * @throws ParseSessionNotFoundException if the session is unknown or expired
   */
  public void close(String sessionId) {
    requireSession(sessionId);
    sessions.invalidate(sessionId);
  }

  /**
   * Evicts expired sessions. Caffeine otherwise only expires entries during other cache
   * activity.
   */
  @Scheduled(fixedDelayString = "${kartograph.parse-dispatcher.cleanup-interval-ms:60000}")
  public void evictExpiredSessions() {
    sessions.cleanUp();
  }

  /**
   * Counts live sessions.
   *
   * @return estimated session count
   */
  public long sessionCount() {
    return sessions.estimatedSize();
  }

  private ParseSessionView view(ParseSession session, long sequence) {
    ParseState state = session.stateOf(sequence);
    ParseSession.Outcome outcome = session.outcome();
    boolean current = outcome.sequence() == sequence;
    return new ParseSessionView(
        session.sessionId(),
        sequence,
        session.latestIssued(),
        state,
        current ? outcome.preview() : null,
        current ? outcome.failure() : null);
  }

  private void startBackground(ParseSession session, long sequence, String input) {
    if (!session.isLatest(sequence)) {
      discard(session, sequence);
      return;
    }
    try {
      parseExecutor.execute(() -> runBackground(session, sequence, input));
    } catch (TaskRejectedException e) {
      logger.warn("Parse executor rejected request {} of session {}: {}",
          sequence, session.sessionId(), e.getMessage());
      session.fail(sequence, "parse queue is full; submit again");
    }
  }

  private void runBackground(ParseSession session, long sequence, String input) {
    if (!session.isLatest(sequence)) {
      discard(session, sequence);
      return;
    }
    ParsePreview preview;
    try {
      preview = compute(input, properties.getPreviewLimit());
    } catch (RuntimeException e) {
      logger.error("Background parse {} of session {} failed", sequence, session.sessionId(), e);
      session.fail(sequence, "parse failed: " + e.getMessage());
      return;
    }
    if (session.offer(sequence, preview)) {
      logger.debug("Background parse {} of session {} ready in {} ms",
          sequence, session.sessionId(), preview.parseTimeMs());
    } else {
      discard(session, sequence);
    }
  }

  private ParsePreview compute(String input, int operationLimit) {
    long start = System.nanoTime();
    if (input.length() > properties.getSummaryThreshold()) {
      ParsedBatch batch = parser.parseStructure(input);
      return assembler.summary(batch, elapsedMs(start));
    }
    ParsedBatch batch = parser.parse(input);
    return assembler.full(batch, elapsedMs(start), operationLimit);
  }

  private void discard(ParseSession session, long sequence) {
    meterRegistry.counter("kartograph.parse.superseded").increment();
    logger.debug("Discarded superseded parse {} of session {} (latest is {})",
        sequence, session.sessionId(), session.latestIssued());
  }

  private ParseSession requireSession(String sessionId) {
    ParseSession session = sessions.getIfPresent(sessionId);
    if (session == null) {
      throw new ParseSessionNotFoundException(sessionId);
    }
    return session;
  }

  private static void validateSessionId(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session id cannot be blank");
    }
    if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
      throw new IllegalArgumentException(
          "Session id cannot be longer than " + MAX_SESSION_ID_LENGTH + " characters");
    }
  }

  private static long elapsedMs(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
  }
}
