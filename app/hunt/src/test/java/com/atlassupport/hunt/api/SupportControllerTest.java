package com.atlassupport.hunt.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.atlassupport.hunt.api.request.SubmitSupportRequest;
import com.atlassupport.hunt.api.response.ClaimTicketResponse;
import com.atlassupport.hunt.api.response.SubmitSupportResponse;
import com.atlassupport.hunt.api.response.TicketStatusResponse;
import com.atlassupport.hunt.repository.StoreUnavailableException;
import com.atlassupport.hunt.service.SupportRequestService;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SupportController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class SupportControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SupportRequestService supportRequestService;

  @Test
  void submitRequestReturnsEscalatedTicket() throws Exception {
    when(supportRequestService.submit(eq("user-1"), any(SubmitSupportRequest.class)))
        .thenReturn(new SubmitSupportResponse(true, "ticket-1a2b3c4d", "HUNTING", "On it."));

    mockMvc
        .perform(
            post("/v1/support/requests")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text":"VPN is down for the whole office","thread_ref":"C1:1700000000.1"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.escalated").value(true))
        .andExpect(jsonPath("$.ticket_id").value("ticket-1a2b3c4d"))
        .andExpect(jsonPath("$.status").value("HUNTING"));
  }

  @Test
  void submitRequestReturns400WhenUserHeaderMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/support/requests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text":"help"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("HUNT_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-User-Id header is required"));

    verifyNoInteractions(supportRequestService);
  }

  @Test
  void submitRequestReturns400WhenTextBlank() throws Exception {
    mockMvc
        .perform(
            post("/v1/support/requests")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text":"  "}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("HUNT_VALIDATION_ERROR"));
  }

  @Test
  void getTicketReturnsStatus() throws Exception {
    when(supportRequestService.getTicket("ticket-1"))
        .thenReturn(
            new TicketStatusResponse(
                "ticket-1",
                "CLAIMED",
                "VIP",
                "TECHNICAL_ISSUE",
                70,
                List.of("vpn"),
                "e1",
                1,
                "2026-03-02T09:00:00Z",
                null));

    mockMvc
        .perform(get("/v1/support/tickets/ticket-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CLAIMED"))
        .andExpect(jsonPath("$.claimed_by").value("e1"))
        .andExpect(jsonPath("$.expertise_tags[0]").value("vpn"));
  }

  @Test
  void getTicketReturns404WhenUnknown() throws Exception {
    when(supportRequestService.getTicket("ticket-x"))
        .thenThrow(new TicketNotFoundException("ticket-x"));

    mockMvc
        .perform(get("/v1/support/tickets/ticket-x"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("HUNT_TICKET_NOT_FOUND"));
  }

  @Test
  void claimReturns200EvenWhenAlreadyClaimed() throws Exception {
    when(supportRequestService.claim("ticket-1", "e2"))
        .thenReturn(
            new ClaimTicketResponse(
                "ticket-1", "ALREADY_CLAIMED", "Ticket ticket-1 was already claimed."));

    mockMvc
        .perform(post("/v1/support/tickets/ticket-1/claim").header("X-Expert-Id", "e2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.result").value("ALREADY_CLAIMED"));
  }

  @Test
  void claimReturns400WhenExpertHeaderMissing() throws Exception {
    mockMvc
        .perform(post("/v1/support/tickets/ticket-1/claim"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("HUNT_BAD_REQUEST"));
  }

  @Test
  void resolveReturns403ForAnotherExpert() throws Exception {
    when(supportRequestService.resolve("ticket-1", "e2"))
        .thenThrow(new TicketAccessDeniedException("ticket-1"));

    mockMvc
        .perform(post("/v1/support/tickets/ticket-1/resolve").header("X-Expert-Id", "e2"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("HUNT_TICKET_FORBIDDEN"));
  }

  @Test
  void cancelReturns503WhenStoreUnavailable() throws Exception {
    when(supportRequestService.cancel("ticket-1", "user-1"))
        .thenThrow(new StoreUnavailableException("write failed", new IOException("disk full")));

    mockMvc
        .perform(delete("/v1/support/tickets/ticket-1").header("X-User-Id", "user-1"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("HUNT_STORE_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("Something went wrong on our side, please retry."));
  }
}
