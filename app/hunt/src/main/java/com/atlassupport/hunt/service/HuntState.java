/*
 * どこで: Hunt サービス層
 * 何を: 実行中 Hunt 1 件分のメモリ上の状態(順位付け済み候補と起床タイマー)を保持する
 * なぜ: 呼び出し済み集合と締切はチケットへ永続化し、再計算できない実行時情報だけをここに置くため
 */
package com.atlassupport.hunt.service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

final class HuntState {

  private final String ticketId;
  private final List<String> rankedCandidates;
  private volatile boolean active = true;
  private ScheduledFuture<?> wakeUp;

  HuntState(String ticketId, List<String> rankedCandidates) {
    this.ticketId = ticketId;
    this.rankedCandidates = List.copyOf(rankedCandidates);
  }

  String ticketId() {
    return ticketId;
  }

  List<String> rankedCandidates() {
    return rankedCandidates;
  }

  boolean active() {
    return active;
  }

  /** 順位順に、まだ呼び出していない候補を最大 width 名返す。 */
  List<String> nextWave(Set<String> notified, int width) {
    return rankedCandidates.stream().filter(id -> !notified.contains(id)).limit(width).toList();
  }

  boolean exhausted(Set<String> notified) {
    return notified.containsAll(rankedCandidates);
  }

  synchronized void replaceWakeUp(ScheduledFuture<?> next) {
    if (wakeUp != null) {
      wakeUp.cancel(false);
    }
    wakeUp = next;
  }

  /** 以降の呼び出しを止め、起床タイマーを取り消す。送信済みの呼び出しは取り消さない。 */
  synchronized void stop() {
    active = false;
    if (wakeUp != null) {
      wakeUp.cancel(false);
      wakeUp = null;
    }
  }
}
