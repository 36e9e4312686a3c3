/*
 * どこで: Hunt API レスポンス DTO
 * 何を: claim 要求の判定結果を定義する
 * なぜ: 競合時もエラーではなく結果と文言で返すため
 */
package com.atlassupport.hunt.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClaimTicketResponse(String ticketId, String result, String message) {}
