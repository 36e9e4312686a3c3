/*
 * どこで: Hunt ドメインモデル
 * 何を: 依頼者の優先度レコードを表現する
 * なぜ: 運用側で編集される優先度をエンジンからは読み取り専用で参照するため
 */
package com.atlassupport.hunt.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserPriority(String userId, PriorityLevel level, Set<String> tags) {

  public UserPriority {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    level = level == null ? PriorityLevel.REGULAR : level;
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }

  /** ディレクトリ未登録ユーザーの既定値。 */
  public static UserPriority regular(String userId) {
    return new UserPriority(userId, PriorityLevel.REGULAR, Set.of());
  }
}
