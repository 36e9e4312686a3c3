/*
 * どこで: Hunt API リクエスト DTO
 * 何を: サポート依頼の投稿内容を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.atlassupport.hunt.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** {@code thread_ref} を省略した場合は依頼者ごとの DM スレッドへ返信する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitSupportRequest(@NotBlank @Size(max = 4000) String text, String threadRef) {}
