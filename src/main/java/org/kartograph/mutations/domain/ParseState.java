package org.kartograph.mutations.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * State of a parse request in an editing session.
 * A request moves from PARSING to READY, or to SUPERSEDED once a newer request is issued
 * before its result is honoured. FAILED means the parse could not run at all.
 */
public enum ParseState {
  IDLE,
  PARSING,
  READY,
  SUPERSEDED,
  FAILED;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
