/*
 * どこで: Hunt サービス層
 * 何を: 通知送信を模擬する実装
 * なぜ: チャット基盤に接続せずに Hunt の状態遷移を確認するため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.config.HuntProperties;
import com.atlassupport.hunt.model.HuntOutcome;
import com.atlassupport.hunt.model.Ticket;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "hunt.notifier",
    havingValue = "local",
    matchIfMissing = true)
public class LocalNotifier implements Notifier {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotifier.class);

  private final HuntProperties properties;

  @Override
  public boolean notify(String recipient, String ticketId, String message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "page simulated bot={} recipient={} ticketId={} message={}",
        properties.botName(),
        recipient,
        ticketId,
        message);
    return true;
  }

  @Override
  public void announceOutcome(String ticketId, HuntOutcome outcome, Collection<String> recipients) {
    for (String recipient : recipients) {
      logger.info(
          "outcome simulated recipient={} ticketId={} outcome={} message={}",
          recipient,
          ticketId,
          outcome,
          outcome.message(ticketId));
    }
  }

  @Override
  public void reply(String threadRef, String message) {
    logger.info("reply simulated threadRef={} message={}", threadRef, message);
  }

  @Override
  public void broadcastFallback(String channel, Ticket ticket) {
    logger.info(
        "fallback broadcast simulated channel={} ticketId={} tags={} urgency={}",
        channel,
        ticket.id(),
        ticket.expertiseTags(),
        ticket.urgencyScore());
  }
}
