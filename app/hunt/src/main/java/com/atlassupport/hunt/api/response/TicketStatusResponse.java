/*
 * どこで: Hunt API レスポンス DTO
 * 何を: チケット状態参照の応答を定義する
 * なぜ: 内部の Ticket 表現を API 契約から切り離すため
 */
package com.atlassupport.hunt.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "API DTO record は応答組み立て専用であり、防御的コピーを行わないため")
public record TicketStatusResponse(
    String ticketId,
    String status,
    String priority,
    String category,
    int urgencyScore,
    List<String> expertiseTags,
    String claimedBy,
    int huntWave,
    String createdAt,
    String waveDeadline) {}
