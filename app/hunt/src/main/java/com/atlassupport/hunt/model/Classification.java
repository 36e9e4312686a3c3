/*
 * どこで: Hunt ドメインモデル
 * 何を: 分類器の出力(緊急度/必要タグ/カテゴリ/下書き返信)を保持する
 * なぜ: 分類器の実装差し替え(LLM/ローカル)に依存しない受け渡し形を固定するため
 */
package com.atlassupport.hunt.model;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record Classification(
    int urgencyScore, Set<String> expertiseTags, RequestCategory category, String draftReply) {

  public static final int MAX_URGENCY = 100;

  private static final String FALLBACK_REPLY =
      "Thanks for reaching out. I'm finding someone on the team who can help with this.";

  public Classification {
    urgencyScore = Math.max(0, Math.min(MAX_URGENCY, urgencyScore));
    expertiseTags =
        expertiseTags == null
            ? Set.of()
            : expertiseTags.stream()
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    category = category == null ? RequestCategory.OTHER : category;
    draftReply = draftReply == null || draftReply.isBlank() ? FALLBACK_REPLY : draftReply;
  }

  /** 分類器が使えない場合の既定値。緊急扱い・タグなし・汎用の返信。 */
  public static Classification fallback() {
    return new Classification(MAX_URGENCY, Set.of(), RequestCategory.OTHER, FALLBACK_REPLY);
  }
}
