/*
 * どこで: Hunt API レスポンス DTO
 * 何を: サポート依頼投稿の応答を定義する
 * なぜ: 即答で済んだか、専門家探索へ回したかを呼び出し側へ明示するため
 */
package com.atlassupport.hunt.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 即答の場合 {@code ticketId} と {@code status} は null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitSupportResponse(
    boolean escalated, String ticketId, String status, String reply) {}
