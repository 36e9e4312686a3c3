/*
 * どこで: Hunt 復旧ワーカー
 * 何を: 起動時と一定間隔で、実行中 Hunt を持たない HUNTING/OPEN チケットを再開する
 * なぜ: プロセス再起動やクラッシュで止まった Hunt を取りこぼさないため
 */
package com.atlassupport.hunt.worker;

import com.atlassupport.hunt.model.Ticket;
import com.atlassupport.hunt.model.TicketStatus;
import com.atlassupport.hunt.repository.TicketStore;
import com.atlassupport.hunt.service.HuntEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "hunt.recovery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class HuntRecoveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(HuntRecoveryWorker.class);

  private final TicketStore ticketStore;
  private final HuntEngine huntEngine;

  public HuntRecoveryWorker(TicketStore ticketStore, HuntEngine huntEngine) {
    this.ticketStore = ticketStore;
    this.huntEngine = huntEngine;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    logger.info("hunt recovery on startup recovered={}", recover());
  }

  @Scheduled(
      fixedDelayString = "${hunt.recovery.interval}",
      initialDelayString = "${hunt.recovery.interval}")
  public void run() {
    final int recovered = recover();
    if (recovered > 0) {
      logger.info("hunt recovery recovered={}", recovered);
    }
  }

  /** 再開または開始した Hunt の件数を返す。 */
  int recover() {
    int recovered = 0;
    try {
      for (Ticket ticket : ticketStore.listByStatus(TicketStatus.HUNTING)) {
        if (resume(ticket.id())) {
          recovered++;
        }
      }
      for (Ticket ticket : ticketStore.listByStatus(TicketStatus.OPEN)) {
        if (start(ticket.id())) {
          recovered++;
        }
      }
    } catch (RuntimeException ex) {
      logger.warn("hunt recovery loop failed", ex);
    }
    return recovered;
  }

  private boolean resume(String ticketId) {
    try {
      return huntEngine.resumeHunt(ticketId);
    } catch (RuntimeException ex) {
      logger.warn("hunt resume failed ticketId={}", ticketId, ex);
      return false;
    }
  }

  private boolean start(String ticketId) {
    try {
      return huntEngine.startHunt(ticketId).status() != TicketStatus.OPEN;
    } catch (RuntimeException ex) {
      logger.warn("hunt start from recovery failed ticketId={}", ticketId, ex);
      return false;
    }
  }
}
