package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import org.kartograph.mutations.domain.ParseState;

/**
 * Response to a parse request in an editing session.
 *
 * @param sessionId editing session
 * @param sequence sequence number of this request
 * @param state READY with a result on the synchronous path, PARSING on the background path,
 *     SUPERSEDED if a newer request overtook a synchronous one
 * @param debounceMs delay before a background parse starts (0 on the synchronous path)
 * @param result the preview (synchronous path only)
 */
@Schema(description = "Parse request receipt")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseTicket(
    @JsonProperty("session_id") String sessionId,
    long sequence,
    ParseState state,
    @JsonProperty("debounce_ms") long debounceMs,
    ParsePreview result
) {}
