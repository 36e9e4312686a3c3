/*
 * どこで: Hunt API リクエスト DTO
 * 何を: 専門家の受付可否の切り替え内容を定義する
 * なぜ: 不在時に Hunt の候補から外すため
 */
package com.atlassupport.hunt.api.request;

import jakarta.validation.constraints.NotNull;

public record ExpertAvailabilityRequest(@NotNull Boolean available) {}
