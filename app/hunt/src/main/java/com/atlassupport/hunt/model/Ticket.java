/*
 * どこで: Hunt ドメインモデル
 * 何を: サポートチケットの正規化された内部表現と状態遷移を定義する
 * なぜ: Store / Engine / API 間で受け渡す構造と、単調な遷移規則を一箇所に固定するため
 */
package com.atlassupport.hunt.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * チケットは削除されず、状態の終端化のみで閉じる。
 *
 * <p>{@code waveDeadline} / {@code notifiedExpertIds} / {@code huntCycle} は Hunt の実行状態を写したもので、
 * 再起動後の Hunt 再開と claim の資格判定に使う。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Ticket(
    String id,
    String requesterId,
    String threadRef,
    String description,
    RequestCategory category,
    Set<String> expertiseTags,
    int urgencyScore,
    PriorityLevel priority,
    TicketStatus status,
    String claimedBy,
    Instant createdAt,
    Instant lastActivityAt,
    int huntWave,
    int huntCycle,
    Instant waveDeadline,
    Set<String> notifiedExpertIds) {

  public Ticket {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("ticket id is required");
    }
    expertiseTags = expertiseTags == null ? Set.of() : Set.copyOf(expertiseTags);
    // 通知順を残すため LinkedHashSet で保持する
    notifiedExpertIds =
        notifiedExpertIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(notifiedExpertIds));
    category = category == null ? RequestCategory.OTHER : category;
    priority = priority == null ? PriorityLevel.REGULAR : priority;
    status = status == null ? TicketStatus.OPEN : status;
    if (status.claimed() == (claimedBy == null || claimedBy.isBlank())) {
      throw new IllegalArgumentException(
          "claimedBy must be set iff status is CLAIMED or RESOLVED ticketId=" + id);
    }
  }

  /**
   * 役割: 分類結果から OPEN チケットを生成する。
   * 動作: id は "ticket-" + 8 桁の hex で採番し、優先度は生成時点の値を複製する。
   * 前提: requesterId は空でないこと。
   */
  public static Ticket open(
      String requesterId,
      String threadRef,
      String description,
      Classification classification,
      PriorityLevel priority,
      Instant now) {
    return new Ticket(
        newTicketId(),
        requesterId,
        threadRef,
        description,
        classification.category(),
        classification.expertiseTags(),
        classification.urgencyScore(),
        priority,
        TicketStatus.OPEN,
        null,
        now,
        now,
        0,
        0,
        null,
        Set.of());
  }

  private static String newTicketId() {
    return "ticket-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }

  public boolean hasNotified(String expertId) {
    return notifiedExpertIds.contains(expertId);
  }

  public Ticket startHunting(Instant now) {
    requireTransition(TicketStatus.HUNTING);
    return next(TicketStatus.HUNTING, null, now, huntWave, 1, null, notifiedExpertIds);
  }

  /** 新しい Wave を記録する。rebroadcast の場合は huntCycle を進める。 */
  public Ticket recordWave(
      Collection<String> pagedExpertIds, Instant deadline, boolean rebroadcast, Instant now) {
    if (status != TicketStatus.HUNTING) {
      throw new IllegalTicketTransitionException(id, status, TicketStatus.HUNTING);
    }
    final Set<String> notified = new LinkedHashSet<>(notifiedExpertIds);
    notified.addAll(pagedExpertIds);
    final int cycle = rebroadcast ? huntCycle + 1 : huntCycle;
    return next(status, null, now, huntWave + 1, cycle, deadline, notified);
  }

  public Ticket claim(String expertId, Instant now) {
    requireTransition(TicketStatus.CLAIMED);
    return next(TicketStatus.CLAIMED, expertId, now, huntWave, huntCycle, null, notifiedExpertIds);
  }

  public Ticket resolve(Instant now) {
    requireTransition(TicketStatus.RESOLVED);
    return next(
        TicketStatus.RESOLVED, claimedBy, now, huntWave, huntCycle, null, notifiedExpertIds);
  }

  public Ticket expire(Instant now) {
    requireTransition(TicketStatus.EXPIRED);
    return next(TicketStatus.EXPIRED, null, now, huntWave, huntCycle, null, notifiedExpertIds);
  }

  public Ticket cancel(Instant now) {
    requireTransition(TicketStatus.CANCELLED);
    return next(TicketStatus.CANCELLED, null, now, huntWave, huntCycle, null, notifiedExpertIds);
  }

  private Ticket next(
      TicketStatus nextStatus,
      String nextClaimedBy,
      Instant now,
      int nextWave,
      int nextCycle,
      Instant nextDeadline,
      Set<String> nextNotified) {
    return new Ticket(
        id,
        requesterId,
        threadRef,
        description,
        category,
        expertiseTags,
        urgencyScore,
        priority,
        nextStatus,
        nextClaimedBy,
        createdAt,
        now,
        nextWave,
        nextCycle,
        nextDeadline,
        nextNotified);
  }

  private void requireTransition(TicketStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalTicketTransitionException(id, status, next);
    }
  }
}
