/*
 * どこで: Hunt ドメインモデル
 * 何を: Hunt 終了時に通知する結果種別を定義する
 * なぜ: Notifier への結果通知を型で区別し、受信者向け文言を一箇所に集めるため
 */
package com.atlassupport.hunt.model;

public enum HuntOutcome {
  CLAIMED("Ticket %s has already been handled by another expert. Thanks for jumping in!"),
  EXPIRED("Nobody picked up ticket %s in time. It has been escalated to the support channel."),
  CANCELLED("Ticket %s was withdrawn by the requester."),
  FAILED("Something went wrong while routing ticket %s. The requester has been asked to retry.");

  private final String template;

  HuntOutcome(String template) {
    this.template = template;
  }

  public String message(String ticketId) {
    return String.format(template, ticketId);
  }
}
