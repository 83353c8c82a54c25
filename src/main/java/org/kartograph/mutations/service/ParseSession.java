package org.kartograph.mutations.service;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.kartograph.mutations.domain.ParseState;
import org.kartograph.mutations.dto.ParsePreview;

/**
 * Parse bookkeeping for one editing session.
 *
 * <p>Every request gets a sequence number from a monotonically increasing counter. A result
 * is honoured only if its sequence is still the latest issued when it arrives; anything else
 * is dropped. Honoured results are swapped in atomically, so there is no lock and no shared
 * mutable parse state.
 */
public final class ParseSession {

  private final String sessionId;
  private final AtomicLong issued = new AtomicLong();
  private final AtomicReference<Outcome> outcome = new AtomicReference<>(Outcome.NONE);
  private final AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();

  /**
   * Result honoured for a request.
   *
   * @param sequence request sequence
   * @param state READY or FAILED
   * @param preview the preview (null when failed)
   * @param failure failure reason (null when ready)
   */
  record Outcome(long sequence, ParseState state, ParsePreview preview, String failure) {
    static final Outcome NONE = new Outcome(0, ParseState.IDLE, null, null);
  }

  ParseSession(String sessionId) {
    this.sessionId = sessionId;
  }

  String sessionId() {
    return sessionId;
  }

  /**
   * Issues the next request sequence, superseding every earlier one.
   *
   * @return the new sequence
   */
  long issue() {
    return issued.incrementAndGet();
  }

  long latestIssued() {
    return issued.get();
  }

  boolean isLatest(long sequence) {
    return issued.get() == sequence;
  }

  /**
   * Records a result if its request is still the latest.
   *
   * @param sequence request sequence
   * @param preview the result
   * @return true if honoured, false if superseded
   */
  boolean offer(long sequence, ParsePreview preview) {
    return accept(new Outcome(sequence, ParseState.READY, preview, null));
  }

  /**
   * Records a failure if its request is still the latest.
   *
   * @param sequence request sequence
   * @param reason failure reason
   * @return true if honoured, false if superseded
   */
  boolean fail(long sequence, String reason) {
    return accept(new Outcome(sequence, ParseState.FAILED, null, reason));
  }

  private boolean accept(Outcome next) {
    Outcome current = outcome.get();
    while (isLatest(next.sequence()) && current.sequence() < next.sequence()) {
      if (outcome.compareAndSet(current, next)) {
        return true;
      }
      current = outcome.get();
    }
    return false;
  }

  Outcome outcome() {
    return outcome.get();
  }

  /**
   * Replaces the pending debounced request, cancelling the previous one if it has not
   * started yet.
   *
   * @param future the newly scheduled request, or null to just cancel
   */
  void replacePending(ScheduledFuture<?> future) {
    ScheduledFuture<?> previous = pending.getAndSet(future);
    if (previous != null) {
      previous.cancel(false);
    }
  }

  /**
   * State of a request of this session.
   *
   * @param sequence request sequence
   * @return the request state
   */
  ParseState stateOf(long sequence) {
    Outcome current = outcome.get();
    if (current.sequence() == sequence) {
      return current.state();
    }
    if (sequence < issued.get()) {
      return ParseState.SUPERSEDED;
    }
    return ParseState.PARSING;
  }
}
