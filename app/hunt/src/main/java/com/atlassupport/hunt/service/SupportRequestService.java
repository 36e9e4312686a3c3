/*
 * どこで: Hunt サービス層
 * 何を: サポート依頼の受付(優先度解決/分類/エスカレーション判定)とチケット操作の入口を提供する
 * なぜ: API から見た業務フローを一箇所にまとめ、Engine は Hunt の状態機械だけに集中させるため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.api.InvalidSupportRequestException;
import com.atlassupport.hunt.api.TicketAccessDeniedException;
import com.atlassupport.hunt.api.TicketNotFoundException;
import com.atlassupport.hunt.api.request.SubmitSupportRequest;
import com.atlassupport.hunt.api.response.ClaimTicketResponse;
import com.atlassupport.hunt.api.response.SubmitSupportResponse;
import com.atlassupport.hunt.api.response.TicketStatusResponse;
import com.atlassupport.hunt.config.HuntProperties;
import com.atlassupport.hunt.model.ClaimResult;
import com.atlassupport.hunt.model.Classification;
import com.atlassupport.hunt.model.PriorityLevel;
import com.atlassupport.hunt.model.RequestCategory;
import com.atlassupport.hunt.model.Ticket;
import com.atlassupport.hunt.model.TicketStatus;
import com.atlassupport.hunt.model.UserPriority;
import com.atlassupport.hunt.repository.ExpertDirectory;
import com.atlassupport.hunt.repository.TicketStore;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SupportRequestService {

  private static final Logger logger = LoggerFactory.getLogger(SupportRequestService.class);

  static final String ESCALATION_ACK =
      "I've notified our support team. A subject matter expert will assist you shortly.";
  static final String DIRECT_THREAD_PREFIX = "dm:";

  private final ExpertDirectory directory;
  private final TicketStore ticketStore;
  private final UrgencyClassifier classifier;
  private final HuntEngine huntEngine;
  private final Notifier notifier;
  private final HuntProperties properties;
  private final HuntMetrics metrics;
  private final Clock clock;

  public SupportRequestService(
      ExpertDirectory directory,
      TicketStore ticketStore,
      UrgencyClassifier classifier,
      HuntEngine huntEngine,
      Notifier notifier,
      HuntProperties properties,
      HuntMetrics metrics,
      Clock clock) {
    this.directory = directory;
    this.ticketStore = ticketStore;
    this.classifier = classifier;
    this.huntEngine = huntEngine;
    this.notifier = notifier;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: サポート依頼を受け付ける。
   * 動作: 優先度を解決して分類し、エスカレーション対象ならチケットを作成して Hunt を開始する。対象外なら下書き返信のみ返す。
   * 前提: 分類器が使えない場合は最も緊急な既定分類で続行する。ストア障害は StoreUnavailableException のまま伝える。
   */
  public SubmitSupportResponse submit(String userId, SubmitSupportRequest request) {
    validateSubmit(userId, request);
    final String threadRef = resolveThreadRef(userId, request.threadRef());
    final PriorityLevel priority =
        directory.findUserPriority(userId).map(UserPriority::level).orElse(PriorityLevel.REGULAR);
    final Classification classification = classify(request.text(), userId);

    if (!shouldEscalate(classification, priority)) {
      logger.info(
          "request answered directly userId={} category={} urgency={}",
          userId,
          classification.category(),
          classification.urgencyScore());
      replySafely(threadRef, classification.draftReply());
      return new SubmitSupportResponse(false, null, null, classification.draftReply());
    }

    final Instant now = clock.instant();
    final Ticket ticket =
        ticketStore.save(
            Ticket.open(userId, threadRef, request.text(), classification, priority, now));
    logger.info(
        "ticket created ticketId={} userId={} priority={} category={} urgency={} tags={}",
        ticket.id(),
        userId,
        priority.value(),
        classification.category(),
        classification.urgencyScore(),
        classification.expertiseTags());
    // Hunt の開始が永続化されてから受付済みを伝える
    final Ticket started = huntEngine.startHunt(ticket.id());
    final String reply = classification.draftReply() + " " + ESCALATION_ACK;
    replySafely(threadRef, reply);
    return new SubmitSupportResponse(true, started.id(), started.status().name(), reply);
  }

  public TicketStatusResponse getTicket(String ticketId) {
    validateId(ticketId, "ticketId");
    return toStatusResponse(requireTicket(ticketId));
  }

  public ClaimTicketResponse claim(String ticketId, String expertId) {
    validateId(ticketId, "ticketId");
    validateId(expertId, "expertId");
    final ClaimResult result = huntEngine.claim(ticketId, expertId);
    return new ClaimTicketResponse(ticketId, result.name(), result.message(ticketId));
  }

  /** 担当した専門家本人だけが解決済みにできる。 */
  public TicketStatusResponse resolve(String ticketId, String expertId) {
    validateId(ticketId, "ticketId");
    validateId(expertId, "expertId");
    final Ticket ticket = requireTicket(ticketId);
    if (ticket.status().claimed() && !expertId.equals(ticket.claimedBy())) {
      throw new TicketAccessDeniedException(ticketId);
    }
    return toStatusResponse(huntEngine.resolve(ticketId));
  }

  /** 依頼者本人による取り下げ。終了済みチケットは現在の状態をそのまま返す。 */
  public TicketStatusResponse cancel(String ticketId, String userId) {
    validateId(ticketId, "ticketId");
    validateId(userId, "userId");
    final Ticket ticket = requireTicket(ticketId);
    if (!userId.equals(ticket.requesterId())) {
      throw new TicketAccessDeniedException(ticketId);
    }
    return toStatusResponse(huntEngine.cancel(ticketId));
  }

  boolean shouldEscalate(Classification classification, PriorityLevel priority) {
    return classification.category() == RequestCategory.URGENT_ISSUE
        || classification.urgencyScore() >= properties.escalationThreshold()
        || priority == PriorityLevel.VIP;
  }

  private Classification classify(String text, String userId) {
    try {
      return classifier.classify(text, userId);
    } catch (ClassificationUnavailableException ex) {
      metrics.recordClassifierFallback();
      logger.warn("classifier unavailable, using fallback classification userId={}", userId, ex);
      return Classification.fallback();
    }
  }

  private void replySafely(String threadRef, String message) {
    try {
      notifier.reply(threadRef, message);
    } catch (RuntimeException ex) {
      metrics.recordNotifyFailure();
      logger.warn("reply to requester failed threadRef={}", threadRef, ex);
    }
  }

  private Ticket requireTicket(String ticketId) {
    return ticketStore.findById(ticketId).orElseThrow(() -> new TicketNotFoundException(ticketId));
  }

  private void validateSubmit(String userId, SubmitSupportRequest request) {
    validateId(userId, "userId");
    if (request == null || request.text() == null || request.text().isBlank()) {
      throw new InvalidSupportRequestException("text is required");
    }
  }

  private void validateId(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new InvalidSupportRequestException(name + " is required");
    }
  }

  private String resolveThreadRef(String userId, String threadRef) {
    if (threadRef == null || threadRef.isBlank()) {
      return DIRECT_THREAD_PREFIX + userId;
    }
    return threadRef;
  }

  private TicketStatusResponse toStatusResponse(Ticket ticket) {
    return new TicketStatusResponse(
        ticket.id(),
        ticket.status().name(),
        ticket.priority().value(),
        ticket.category().name(),
        ticket.urgencyScore(),
        ticket.expertiseTags().stream().sorted().toList(),
        ticket.claimedBy(),
        ticket.huntWave(),
        toIsoOrNull(ticket.createdAt()),
        ticket.status() == TicketStatus.HUNTING ? toIsoOrNull(ticket.waveDeadline()) : null);
  }

  private String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
