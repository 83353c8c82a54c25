package org.kartograph.mutations.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.kartograph.mutations.domain.ParseState;
import org.kartograph.mutations.dto.ParseSessionView;
import org.kartograph.mutations.dto.ParseTicket;
import org.kartograph.mutations.exception.ParseSessionNotFoundException;
import org.kartograph.mutations.service.ParseDispatcher;
import org.kartograph.mutations.testutil.TestMeterRegistryConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for ParseSessionController.
 */
@WebMvcTest(ParseSessionController.class)
@Import(TestMeterRegistryConfig.class)
class ParseSessionControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private ParseDispatcher dispatcher;

  @Test
  void parse_shouldReturn202_whenParsingInBackground() throws Exception {
    // Given
    when(dispatcher.submit(eq("s1"), any()))
        .thenReturn(new ParseTicket("s1", 4, ParseState.PARSING, 300, null));

    // When / Then
    mockMvc.perform(post("/graph/mutations/sessions/{sessionId}/parse", "s1")
            .contentType(MediaType.TEXT_PLAIN)
            .content("{}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.session_id").value("s1"))
        .andExpect(jsonPath("$.sequence").value(4))
        .andExpect(jsonPath("$.state").value("parsing"))
        .andExpect(jsonPath("$.debounce_ms").value(300))
        .andExpect(jsonPath("$.result").doesNotExist());
  }

  @Test
  void parse_shouldReturn200_whenParsedSynchronously() throws Exception {
    // Given
    when(dispatcher.submit(eq("s1"), any()))
        .thenReturn(new ParseTicket("s1", 1, ParseState.SUPERSEDED, 0, null));

    // When / Then
    mockMvc.perform(post("/graph/mutations/sessions/{sessionId}/parse", "s1")
            .contentType(MediaType.TEXT_PLAIN)
            .content("{}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("superseded"));
  }

  @Test
  void parse_shouldReturn400_whenSessionIdIsInvalid() throws Exception {
    // Given
    String sessionId = "x".repeat(129);
    when(dispatcher.submit(eq(sessionId), any())).thenThrow(
        new IllegalArgumentException("Session id cannot be longer than 128 characters"));

    // When / Then
    mockMvc.perform(post("/graph/mutations/sessions/{sessionId}/parse", sessionId)
            .contentType(MediaType.TEXT_PLAIN)
            .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void get_shouldReturnRequestedSequence() throws Exception {
    // Given
    when(dispatcher.view("s1", 2L))
        .thenReturn(new ParseSessionView("s1", 2, 3, ParseState.SUPERSEDED, null, null));

    // When / Then
    mockMvc.perform(get("/graph/mutations/sessions/{sessionId}", "s1")
            .param("sequence", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sequence").value(2))
        .andExpect(jsonPath("$.latest_sequence").value(3))
        .andExpect(jsonPath("$.state").value("superseded"));
  }

  @Test
  void get_shouldReturn404_whenSessionIsUnknown() throws Exception {
    // Given
    when(dispatcher.view("gone")).thenThrow(new ParseSessionNotFoundException("gone"));

    // When / Then
    mockMvc.perform(get("/graph/mutations/sessions/{sessionId}", "gone"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.code").value("parse_session_not_found"));
  }

  @Test
  void get_shouldReturn400_whenSequenceIsNotNumeric() throws Exception {
    mockMvc.perform(get("/graph/mutations/sessions/{sessionId}", "s1")
            .param("sequence", "latest"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void close_shouldReturn204() throws Exception {
    mockMvc.perform(delete("/graph/mutations/sessions/{sessionId}", "s1"))
        .andExpect(status().isNoContent());

    verify(dispatcher).close("s1");
  }

  @Test
  void close_shouldReturn404_whenSessionIsUnknown() throws Exception {
    // Given
    doThrow(new ParseSessionNotFoundException("gone")).when(dispatcher).close("gone");

    // When / Then
    mockMvc.perform(delete("/graph/mutations/sessions/{sessionId}", "gone"))
        .andExpect(status().isNotFound());
  }
}
