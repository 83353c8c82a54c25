package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import org.kartograph.mutations.domain.ParseState;

/**
 * Current state of an editing session. A result is present only when it belongs to the
 * latest request; results of superseded requests are never shown.
 *
 * @param sessionId editing session
 * @param sequence the request this view describes
 * @param latestSequence latest request issued in the session
 * @param state state of the described request
 * @param result the preview, when the described request is the latest and ready
 * @param failure why the parse could not run, when failed
 */
@Schema(description = "Editing session state")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseSessionView(
    @JsonProperty("session_id") String sessionId,
    long sequence,
    @JsonProperty("latest_sequence") long latestSequence,
    ParseState state,
    ParsePreview result,
    String failure
) {}
