/*
 * どこで: Hunt API
 * 何を: 現在の状態では受け付けられない操作を表現する
 * なぜ: 未 claim チケットの resolve などを 409 へ変換するため
 */
package com.atlassupport.hunt.api;

import com.atlassupport.hunt.model.TicketStatus;
import java.util.Locale;

public class TicketStateConflictException extends RuntimeException {
  public TicketStateConflictException(String ticketId, TicketStatus status) {
    super("ticket " + ticketId + " is " + status.name().toLowerCase(Locale.ROOT));
  }
}
