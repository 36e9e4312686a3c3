/*
 * どこで: Hunt サービス層
 * 何を: チケットごとの Hunt(Wave 呼び出し/締切/再送/claim 競合解決/キャンセル)を実行する
 * なぜ: 状態遷移をチケットロック下で全順序化し、claim の二重受理と専門家の過剰割り当てを防ぐため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.common.logging.MdcScope;
import com.atlassupport.hunt.api.TicketNotFoundException;
import com.atlassupport.hunt.api.TicketStateConflictException;
import com.atlassupport.hunt.config.HuntProperties;
import com.atlassupport.hunt.config.HuntSchedulerConfig.HuntLocks;
import com.atlassupport.hunt.model.ClaimResult;
import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.model.HuntOutcome;
import com.atlassupport.hunt.model.IllegalTicketTransitionException;
import com.atlassupport.hunt.model.PriorityLevel;
import com.atlassupport.hunt.model.Ticket;
import com.atlassupport.hunt.model.TicketStatus;
import com.atlassupport.hunt.repository.ExpertDirectory;
import com.atlassupport.hunt.repository.StoreUnavailableException;
import com.atlassupport.hunt.repository.TicketStore;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
public class HuntEngine {

  private static final Logger logger = LoggerFactory.getLogger(HuntEngine.class);

  static final String MDC_TICKET_ID = "ticket_id";
  static final String PAGE_MESSAGE =
      "[%s] Ticket %s needs an expert (urgency %d, tags %s). Use /claim %s to take it.";
  static final String CLAIMED_REPLY = "Good news! %s will be assisting you with this request.";
  static final String EXPIRED_REPLY =
      "I'm still looking for the best team member to assist you. Someone will respond as soon as"
          + " possible.";
  static final String RESOLVED_REPLY = "Your request has been marked as resolved. Thanks!";
  static final String RETRY_REPLY =
      "Something went wrong on our side while finding an expert. Please retry your request.";

  private final TicketStore ticketStore;
  private final ExpertDirectory directory;
  private final ExpertMatcher matcher;
  private final Notifier notifier;
  private final HuntProperties properties;
  private final HuntMetrics metrics;
  private final HuntLocks locks;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TaskScheduler は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final TaskScheduler taskScheduler;

  private final Clock clock;
  private final ConcurrentMap<String, HuntState> activeHunts = new ConcurrentHashMap<>();
  // 整合性エラーで停止した Hunt。プロセス内では自動再試行しない
  private final Set<String> failedHunts = ConcurrentHashMap.newKeySet();

  public HuntEngine(
      TicketStore ticketStore,
      ExpertDirectory directory,
      ExpertMatcher matcher,
      Notifier notifier,
      HuntProperties properties,
      HuntMetrics metrics,
      HuntLocks locks,
      TaskScheduler taskScheduler,
      Clock clock) {
    this.ticketStore = ticketStore;
    this.directory = directory;
    this.matcher = matcher;
    this.notifier = notifier;
    this.properties = properties;
    this.metrics = metrics;
    this.locks = locks;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
  }

  /**
   * 役割: OPEN チケットの Hunt を開始する。
   * 動作: HUNTING へ遷移して候補を順位付けし、最初の Wave を呼び出す。候補ゼロなら呼び出しを行わず EXPIRED にしてフォールバック通知する。
   * 前提: OPEN 以外のチケットに対しては何もせず現在値を返す。永続化失敗は StoreUnavailableException として呼び出し側へ伝える。
   * Wave の永続化に失敗した場合は Hunt を破棄し、依頼者へ再試行を案内してから送出する。
   */
  public Ticket startHunt(String ticketId) {
    try (MdcScope ignored = MdcScope.withTrace(MDC_TICKET_ID, ticketId)) {
      final List<Runnable> afterUnlock = new ArrayList<>();
      Ticket result;
      RuntimeException failure = null;
      final Lock lock = locks.ticket(ticketId);
      lock.lock();
      try {
        final Ticket ticket = requireTicket(ticketId);
        if (ticket.status() != TicketStatus.OPEN) {
          logger.info("hunt start skipped ticketId={} status={}", ticketId, ticket.status());
          return ticket;
        }
        final Ticket hunting = ticketStore.save(ticket.startHunting(clock.instant()));
        metrics.recordHuntStarted();
        final List<String> ranked = rankCandidates(hunting);
        logger.info(
            "hunt started ticketId={} priority={} urgency={} tags={} candidates={}",
            ticketId,
            hunting.priority().value(),
            hunting.urgencyScore(),
            hunting.expertiseTags(),
            ranked.size());
        try {
          if (ranked.isEmpty()) {
            result = expireLocked(hunting, null, "no_candidates", afterUnlock);
          } else {
            final HuntState state = new HuntState(ticketId, ranked);
            activeHunts.put(ticketId, state);
            result = issueWaveLocked(state, hunting, afterUnlock);
          }
        } catch (StoreUnavailableException | IllegalTicketTransitionException ex) {
          // 未永続の Wave は呼び出さない
          afterUnlock.clear();
          failLocked(ticketId, hunting, ex, afterUnlock);
          result = hunting;
          failure = ex;
        }
      } finally {
        metrics.updateActiveHunts(activeHunts.size());
        lock.unlock();
      }
      runAfterUnlock(afterUnlock);
      if (failure != null) {
        throw failure;
      }
      return result;
    }
  }

  /**
   * 役割: Wave の締切到来を処理する。
   * 動作: 未呼び出し候補が残れば次の Wave、尽きていれば設定に従って全候補への再送、それも尽きれば EXPIRED にする。
   * 前提: スケジューラと復旧ワーカーから呼ばれる。終了済み/未登録の Hunt に対する起床は無視する。
   */
  public void onWaveDeadline(String ticketId) {
    try (MdcScope ignored = MdcScope.withTrace(MDC_TICKET_ID, ticketId)) {
      final List<Runnable> afterUnlock = new ArrayList<>();
      final Lock lock = locks.ticket(ticketId);
      lock.lock();
      Ticket ticket = null;
      try {
        final HuntState state = activeHunts.get(ticketId);
        if (state == null) {
          logger.debug("stale wake-up ignored ticketId={}", ticketId);
          return;
        }
        ticket = ticketStore.findById(ticketId).orElse(null);
        if (ticket == null || ticket.status() != TicketStatus.HUNTING) {
          stopLocked(state);
          return;
        }
        final Instant deadline = ticket.waveDeadline();
        if (deadline != null && clock.instant().isBefore(deadline)) {
          scheduleWakeUp(state, deadline);
          return;
        }
        advanceLocked(state, ticket, afterUnlock);
      } catch (StoreUnavailableException | IllegalTicketTransitionException ex) {
        failLocked(ticketId, ticket, ex, afterUnlock);
      } finally {
        metrics.updateActiveHunts(activeHunts.size());
        lock.unlock();
      }
      runAfterUnlock(afterUnlock);
    }
  }

  /**
   * 役割: 専門家による claim を判定する。
   * 動作: チケットロック → 専門家ロックの順に取得し、受理時のみ専門家の負荷とチケット状態を永続化する。
   * 前提: 1 チケットにつき ACCEPTED は高々 1 回。呼び出されていない専門家や終了済みチケットへの claim は NOT_ELIGIBLE。
   */
  public ClaimResult claim(String ticketId, String expertId) {
    try (MdcScope ignored = MdcScope.withTrace(MDC_TICKET_ID, ticketId)) {
      final List<Runnable> afterUnlock = new ArrayList<>();
      final ClaimResult result;
      final Lock lock = locks.ticket(ticketId);
      lock.lock();
      try {
        result = claimLocked(ticketId, expertId, afterUnlock);
      } finally {
        metrics.updateActiveHunts(activeHunts.size());
        lock.unlock();
      }
      metrics.recordClaimResult(result);
      logger.info("claim resolved ticketId={} expertId={} result={}", ticketId, expertId, result);
      runAfterUnlock(afterUnlock);
      return result;
    }
  }

  /**
   * 役割: claim 済みチケットを解決済みにする。
   * 動作: 担当専門家の負荷を 1 減らしてから RESOLVED を永続化する。既に RESOLVED なら現在値を返す。
   * 前提: CLAIMED/RESOLVED 以外では TicketStateConflictException を送出する。
   */
  public Ticket resolve(String ticketId) {
    try (MdcScope ignored = MdcScope.withTrace(MDC_TICKET_ID, ticketId)) {
      final Ticket resolved;
      final Lock lock = locks.ticket(ticketId);
      lock.lock();
      try {
        final Ticket ticket = requireTicket(ticketId);
        if (ticket.status() == TicketStatus.RESOLVED) {
          return ticket;
        }
        if (ticket.status() != TicketStatus.CLAIMED) {
          throw new TicketStateConflictException(ticketId, ticket.status());
        }
        resolved = resolveLocked(ticket);
      } finally {
        lock.unlock();
      }
      logger.info("ticket resolved ticketId={} expertId={}", ticketId, resolved.claimedBy());
      safely("reply", () -> notifier.reply(resolved.threadRef(), RESOLVED_REPLY));
      return resolved;
    }
  }

  /**
   * 役割: 依頼者の取り下げ等で Hunt を打ち切る。
   * 動作: OPEN/HUNTING なら CANCELLED を永続化し、以降の呼び出しと起床を止める。通知は行わない。
   * 前提: 既に終了しているチケットは現在値をそのまま返す。
   */
  public Ticket cancel(String ticketId) {
    try (MdcScope ignored = MdcScope.withTrace(MDC_TICKET_ID, ticketId)) {
      final Lock lock = locks.ticket(ticketId);
      lock.lock();
      try {
        final Ticket ticket = requireTicket(ticketId);
        if (!ticket.status().canTransitionTo(TicketStatus.CANCELLED)) {
          return ticket;
        }
        final Ticket cancelled = ticketStore.save(ticket.cancel(clock.instant()));
        final HuntState state = activeHunts.get(ticketId);
        if (state != null) {
          stopLocked(state);
        }
        metrics.recordOutcome(HuntOutcome.CANCELLED);
        logger.info("hunt cancelled ticketId={} waves={}", ticketId, cancelled.huntWave());
        return cancelled;
      } finally {
        metrics.updateActiveHunts(activeHunts.size());
        lock.unlock();
      }
    }
  }

  /**
   * 役割: 再起動等でメモリ上の状態を失った HUNTING チケットの Hunt を再開する。
   * 動作: 候補を再計算し、締切を過ぎていれば締切処理を即時実行、未到来なら起床を再設定する。
   * 前提: 実行中または本プロセスで失敗済みの Hunt は対象外で false を返す。
   */
  public boolean resumeHunt(String ticketId) {
    if (activeHunts.containsKey(ticketId) || failedHunts.contains(ticketId)) {
      return false;
    }
    try (MdcScope ignored = MdcScope.withTrace(MDC_TICKET_ID, ticketId)) {
      final List<Runnable> afterUnlock = new ArrayList<>();
      final Lock lock = locks.ticket(ticketId);
      lock.lock();
      Ticket ticket = null;
      try {
        if (activeHunts.containsKey(ticketId)) {
          return false;
        }
        ticket = ticketStore.findById(ticketId).orElse(null);
        if (ticket == null || ticket.status() != TicketStatus.HUNTING) {
          return false;
        }
        final HuntState state = new HuntState(ticketId, rankCandidates(ticket));
        activeHunts.put(ticketId, state);
        final Instant deadline = ticket.waveDeadline();
        logger.info(
            "hunt resumed ticketId={} wave={} deadline={} candidates={}",
            ticketId,
            ticket.huntWave(),
            deadline,
            state.rankedCandidates().size());
        if (deadline == null || !clock.instant().isBefore(deadline)) {
          advanceLocked(state, ticket, afterUnlock);
        } else {
          scheduleWakeUp(state, deadline);
        }
      } catch (StoreUnavailableException | IllegalTicketTransitionException ex) {
        failLocked(ticketId, ticket, ex, afterUnlock);
      } finally {
        metrics.updateActiveHunts(activeHunts.size());
        lock.unlock();
      }
      runAfterUnlock(afterUnlock);
      return true;
    }
  }

  public boolean hunting(String ticketId) {
    return activeHunts.containsKey(ticketId);
  }

  public int activeHuntCount() {
    return activeHunts.size();
  }

  @VisibleForTesting
  int waveWidth(Ticket ticket) {
    if (ticket.priority() == PriorityLevel.VIP
        || ticket.urgencyScore() >= properties.highUrgencyThreshold()) {
      return properties.vipWaveWidth();
    }
    return 1;
  }

  private void advanceLocked(HuntState state, Ticket ticket, List<Runnable> afterUnlock) {
    final Instant now = clock.instant();
    if (state.rankedCandidates().isEmpty()) {
      expireLocked(ticket, state, "no_candidates", afterUnlock);
      return;
    }
    if (!now.isBefore(huntExpiresAt(ticket))) {
      expireLocked(ticket, state, "hunt_expiry", afterUnlock);
      return;
    }
    if (!state.exhausted(ticket.notifiedExpertIds())) {
      issueWaveLocked(state, ticket, afterUnlock);
      return;
    }
    if (properties.rebroadcastEnabled() && ticket.huntCycle() < properties.maxWaveCycles()) {
      issueWaveLocked(state, ticket, afterUnlock);
      return;
    }
    expireLocked(ticket, state, "candidates_exhausted", afterUnlock);
  }

  private Ticket issueWaveLocked(HuntState state, Ticket ticket, List<Runnable> afterUnlock) {
    final Instant now = clock.instant();
    final boolean rebroadcast = state.exhausted(ticket.notifiedExpertIds());
    final List<String> wave =
        rebroadcast
            ? state.rankedCandidates()
            : state.nextWave(ticket.notifiedExpertIds(), waveWidth(ticket));
    final Instant deadline = earliest(now.plus(properties.waveTimeout()), huntExpiresAt(ticket));
    final Ticket updated = ticketStore.save(ticket.recordWave(wave, deadline, rebroadcast, now));
    scheduleWakeUp(state, deadline);
    metrics.recordWave();
    logger.info(
        "hunt wave issued ticketId={} wave={} cycle={} rebroadcast={} paged={} deadline={}",
        updated.id(),
        updated.huntWave(),
        updated.huntCycle(),
        rebroadcast,
        wave,
        deadline);
    afterUnlock.add(() -> page(state, updated, wave));
    return updated;
  }

  private void page(HuntState state, Ticket ticket, List<String> wave) {
    final String message =
        String.format(
            PAGE_MESSAGE,
            properties.botName(),
            ticket.id(),
            ticket.urgencyScore(),
            ticket.expertiseTags(),
            ticket.id());
    for (String expertId : wave) {
      if (!state.active()) {
        logger.info(
            "page skipped after hunt stopped ticketId={} expertId={}", ticket.id(), expertId);
        return;
      }
      try {
        if (!notifier.notify(expertId, ticket.id(), message)) {
          metrics.recordNotifyFailure();
          logger.warn("page rejected ticketId={} expertId={}", ticket.id(), expertId);
        }
      } catch (RuntimeException ex) {
        // 1 名の失敗で残りの候補への呼び出しを止めない
        metrics.recordNotifyFailure();
        logger.warn("page failed ticketId={} expertId={}", ticket.id(), expertId, ex);
      }
    }
  }

  private ClaimResult claimLocked(String ticketId, String expertId, List<Runnable> afterUnlock) {
    final Optional<Ticket> found = ticketStore.findById(ticketId);
    if (found.isEmpty()) {
      return ClaimResult.UNKNOWN_TICKET;
    }
    final Ticket ticket = found.get();
    if (ticket.status().claimed()) {
      return ClaimResult.ALREADY_CLAIMED;
    }
    if (!ticket.hasNotified(expertId) || ticket.status() != TicketStatus.HUNTING) {
      return ClaimResult.NOT_ELIGIBLE;
    }
    final Instant now = clock.instant();
    final Expert assigned;
    final Ticket claimed;
    final Lock expertLock = locks.expert(expertId);
    expertLock.lock();
    try {
      final Optional<Expert> expert = directory.findExpert(expertId);
      if (expert.isEmpty() || !expert.get().eligible()) {
        return ClaimResult.NOT_ELIGIBLE;
      }
      final Expert before = expert.get();
      assigned = directory.saveExpert(before.withCurrentLoad(before.currentLoad() + 1));
      try {
        claimed = ticketStore.save(ticket.claim(expertId, now));
      } catch (StoreUnavailableException ex) {
        revertExpert(before, ex);
        throw ex;
      }
    } finally {
      expertLock.unlock();
    }

    final HuntState state = activeHunts.get(ticketId);
    if (state != null) {
      stopLocked(state);
    }
    metrics.recordOutcome(HuntOutcome.CLAIMED);
    metrics.recordTimeToClaim(Duration.between(ticket.createdAt(), now));
    final List<String> others =
        claimed.notifiedExpertIds().stream().filter(id -> !id.equals(expertId)).toList();
    afterUnlock.add(
        () ->
            safely(
                "reply",
                () ->
                    notifier.reply(
                        claimed.threadRef(), String.format(CLAIMED_REPLY, assigned.name()))));
    if (!others.isEmpty()) {
      afterUnlock.add(
          () ->
              safely(
                  "announce",
                  () -> notifier.announceOutcome(ticketId, HuntOutcome.CLAIMED, others)));
    }
    return ClaimResult.ACCEPTED;
  }

  private Ticket resolveLocked(Ticket ticket) {
    final String expertId = ticket.claimedBy();
    final Lock expertLock = locks.expert(expertId);
    expertLock.lock();
    try {
      final Expert before = directory.findExpert(expertId).orElse(null);
      if (before == null) {
        logger.warn(
            "claimant missing from directory ticketId={} expertId={}", ticket.id(), expertId);
        return ticketStore.save(ticket.resolve(clock.instant()));
      }
      directory.saveExpert(before.withCurrentLoad(Math.max(0, before.currentLoad() - 1)));
      try {
        return ticketStore.save(ticket.resolve(clock.instant()));
      } catch (StoreUnavailableException ex) {
        revertExpert(before, ex);
        throw ex;
      }
    } finally {
      expertLock.unlock();
    }
  }

  private Ticket expireLocked(
      Ticket ticket, HuntState state, String reason, List<Runnable> afterUnlock) {
    final Ticket expired = ticketStore.save(ticket.expire(clock.instant()));
    if (state != null) {
      stopLocked(state);
    }
    metrics.recordOutcome(HuntOutcome.EXPIRED);
    logger.info(
        "hunt expired ticketId={} reason={} waves={} notified={}",
        expired.id(),
        reason,
        expired.huntWave(),
        expired.notifiedExpertIds().size());
    afterUnlock.add(
        () ->
            safely(
                "fallback",
                () -> notifier.broadcastFallback(properties.fallbackChannel(), expired)));
    afterUnlock.add(
        () -> safely("reply", () -> notifier.reply(expired.threadRef(), EXPIRED_REPLY)));
    if (!expired.notifiedExpertIds().isEmpty()) {
      afterUnlock.add(
          () ->
              safely(
                  "announce",
                  () ->
                      notifier.announceOutcome(
                          expired.id(), HuntOutcome.EXPIRED, expired.notifiedExpertIds())));
    }
    return expired;
  }

  private void failLocked(
      String ticketId, Ticket ticket, RuntimeException ex, List<Runnable> afterUnlock) {
    final HuntState state = activeHunts.get(ticketId);
    if (state != null) {
      stopLocked(state);
    }
    failedHunts.add(ticketId);
    metrics.recordOutcome(HuntOutcome.FAILED);
    logger.error("hunt aborted by integrity failure ticketId={}", ticketId, ex);
    if (ticket == null) {
      return;
    }
    afterUnlock.add(() -> safely("reply", () -> notifier.reply(ticket.threadRef(), RETRY_REPLY)));
    if (!ticket.notifiedExpertIds().isEmpty()) {
      afterUnlock.add(
          () ->
              safely(
                  "announce",
                  () ->
                      notifier.announceOutcome(
                          ticketId, HuntOutcome.FAILED, ticket.notifiedExpertIds())));
    }
  }

  private void stopLocked(HuntState state) {
    state.stop();
    activeHunts.remove(state.ticketId(), state);
  }

  private void scheduleWakeUp(HuntState state, Instant deadline) {
    final String ticketId = state.ticketId();
    state.replaceWakeUp(taskScheduler.schedule(() -> onWaveDeadline(ticketId), deadline));
  }

  private void revertExpert(Expert before, StoreUnavailableException cause) {
    try {
      directory.saveExpert(before);
    } catch (StoreUnavailableException revertEx) {
      cause.addSuppressed(revertEx);
      logger.error(
          "expert load revert failed expertId={} currentLoad={}",
          before.id(),
          before.currentLoad(),
          revertEx);
    }
  }

  private List<String> rankCandidates(Ticket ticket) {
    return matcher.rank(ticket.expertiseTags(), directory.listExperts(), ticket.priority());
  }

  private Ticket requireTicket(String ticketId) {
    return ticketStore.findById(ticketId).orElseThrow(() -> new TicketNotFoundException(ticketId));
  }

  private Instant huntExpiresAt(Ticket ticket) {
    return ticket.createdAt().plus(properties.huntExpiry());
  }

  private static Instant earliest(Instant a, Instant b) {
    return a.isBefore(b) ? a : b;
  }

  private void runAfterUnlock(List<Runnable> actions) {
    for (Runnable action : actions) {
      action.run();
    }
  }

  private void safely(String action, Runnable delivery) {
    try {
      delivery.run();
    } catch (RuntimeException ex) {
      metrics.recordNotifyFailure();
      logger.warn("notifier {} failed", action, ex);
    }
  }
}
