/*
 * どこで: Hunt API
 * 何を: ticket 未検出を表現する
 * なぜ: status/resolve/cancel の 404 応答へ変換するため
 */
package com.atlassupport.hunt.api;

public class TicketNotFoundException extends RuntimeException {
  public TicketNotFoundException(String ticketId) {
    super("ticket not found: " + ticketId);
  }
}
