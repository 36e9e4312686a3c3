/*
 * どこで: Hunt ドメインモデル
 * 何を: 許可されない状態遷移を表現する
 * なぜ: 不変条件違反をデータ整合性エラーとして呼び出し側へ伝えるため
 */
package com.atlassupport.hunt.model;

public class IllegalTicketTransitionException extends RuntimeException {
  public IllegalTicketTransitionException(String ticketId, TicketStatus from, TicketStatus to) {
    super("illegal ticket transition ticketId=" + ticketId + " from=" + from + " to=" + to);
  }
}
