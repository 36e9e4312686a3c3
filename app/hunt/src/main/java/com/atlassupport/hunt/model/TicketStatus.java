/*
 * どこで: Hunt ドメインモデル
 * 何を: チケット状態と許可される遷移を定義する
 * なぜ: 状態が後戻りしないこと(claimed -> hunting 等の禁止)を一箇所で保証するため
 */
package com.atlassupport.hunt.model;

import java.util.EnumSet;
import java.util.Set;

public enum TicketStatus {
  OPEN,
  HUNTING,
  CLAIMED,
  RESOLVED,
  EXPIRED,
  CANCELLED;

  public boolean canTransitionTo(TicketStatus next) {
    return allowedNext().contains(next);
  }

  /** claimedBy が必ず設定されている状態。 */
  public boolean claimed() {
    return this == CLAIMED || this == RESOLVED;
  }

  private Set<TicketStatus> allowedNext() {
    switch (this) {
      case OPEN:
        return EnumSet.of(HUNTING, CANCELLED);
      case HUNTING:
        return EnumSet.of(CLAIMED, EXPIRED, CANCELLED);
      case CLAIMED:
        return EnumSet.of(RESOLVED);
      default:
        return EnumSet.noneOf(TicketStatus.class);
    }
  }
}
