/*
 * どこで: Hunt ドメインモデル
 * 何を: claim 要求の結果と、専門家へ返す文言を定義する
 * なぜ: 競合や期限切れをエラーではなく結果値として扱い、常に平易な文言で返すため
 */
package com.atlassupport.hunt.model;

public enum ClaimResult {
  ACCEPTED("You have successfully claimed ticket %s."),
  ALREADY_CLAIMED("Ticket %s has already been handled by another expert."),
  NOT_ELIGIBLE(
      "You can't claim ticket %s right now. It may have expired, you may not have been paged"
          + " for it, or you may already be at capacity."),
  UNKNOWN_TICKET("Ticket %s does not exist.");

  private final String template;

  ClaimResult(String template) {
    this.template = template;
  }

  public String message(String ticketId) {
    return String.format(template, ticketId);
  }
}
