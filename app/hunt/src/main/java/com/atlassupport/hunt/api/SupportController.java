/*
 * どこで: Hunt API
 * 何を: サポート依頼の受付とチケットの参照/claim/解決/取り下げエンドポイントを公開する
 * なぜ: チャット連携側からの操作を受け付ける入口を提供するため
 */
package com.atlassupport.hunt.api;

import com.atlassupport.hunt.api.request.SubmitSupportRequest;
import com.atlassupport.hunt.api.response.ClaimTicketResponse;
import com.atlassupport.hunt.api.response.SubmitSupportResponse;
import com.atlassupport.hunt.api.response.TicketStatusResponse;
import com.atlassupport.hunt.config.RequestMdcInterceptor;
import com.atlassupport.hunt.service.SupportRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/support")
@RequiredArgsConstructor
public class SupportController {

  private final SupportRequestService supportRequestService;

  @PostMapping("/requests")
  public ResponseEntity<SubmitSupportResponse> submitRequest(
      @RequestHeader(RequestMdcInterceptor.HEADER_USER_ID) String userId,
      @Valid @RequestBody SubmitSupportRequest request) {
    return ResponseEntity.ok(supportRequestService.submit(userId, request));
  }

  @GetMapping("/tickets/{ticketId}")
  public ResponseEntity<TicketStatusResponse> getTicket(
      @PathVariable("ticketId") String ticketId) {
    return ResponseEntity.ok(supportRequestService.getTicket(ticketId));
  }

  /** 競合や期限切れも 200 で結果と文言を返す。 */
  @PostMapping("/tickets/{ticketId}/claim")
  public ResponseEntity<ClaimTicketResponse> claimTicket(
      @PathVariable("ticketId") String ticketId,
      @RequestHeader(RequestMdcInterceptor.HEADER_EXPERT_ID) String expertId) {
    return ResponseEntity.ok(supportRequestService.claim(ticketId, expertId));
  }

  @PostMapping("/tickets/{ticketId}/resolve")
  public ResponseEntity<TicketStatusResponse> resolveTicket(
      @PathVariable("ticketId") String ticketId,
      @RequestHeader(RequestMdcInterceptor.HEADER_EXPERT_ID) String expertId) {
    return ResponseEntity.ok(supportRequestService.resolve(ticketId, expertId));
  }

  @DeleteMapping("/tickets/{ticketId}")
  public ResponseEntity<TicketStatusResponse> cancelTicket(
      @PathVariable("ticketId") String ticketId,
      @RequestHeader(RequestMdcInterceptor.HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(supportRequestService.cancel(ticketId, userId));
  }
}
