/*
 * どこで: Hunt ドメインモデル
 * 何を: 専門家(SME)のスナップショットを表現する
 * なぜ: Matcher/claim 判定/ディレクトリ永続化で同じ不変表現を共有するため
 */
package com.atlassupport.hunt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Expert(
    String id,
    String name,
    Set<String> expertiseTags,
    Map<String, Integer> skillRatings,
    boolean available,
    int currentLoad,
    int maxConcurrent) {

  public static final int DEFAULT_MAX_CONCURRENT = 3;
  public static final int MIN_RATING = 1;
  public static final int MAX_RATING = 5;

  public Expert {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("expert id is required");
    }
    if (maxConcurrent <= 0) {
      throw new IllegalArgumentException("maxConcurrent must be positive expertId=" + id);
    }
    if (currentLoad < 0 || currentLoad > maxConcurrent) {
      throw new IllegalArgumentException(
          "currentLoad out of range expertId=" + id + " currentLoad=" + currentLoad);
    }
    name = name == null || name.isBlank() ? id : name;
    expertiseTags = normalizeTags(expertiseTags);
    skillRatings = normalizeRatings(id, expertiseTags, skillRatings);
  }

  /**
   * 役割: 永続化 JSON から Expert を復元する。
   * 動作: 欠落した項目は既定値(available=true, currentLoad=0, maxConcurrent=3)で補う。
   * 前提: id は必須。
   */
  @JsonCreator
  public static Expert fromJson(
      @JsonProperty("id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("expertise_tags") Set<String> expertiseTags,
      @JsonProperty("skill_ratings") Map<String, Integer> skillRatings,
      @JsonProperty("available") Boolean available,
      @JsonProperty("current_load") Integer currentLoad,
      @JsonProperty("max_concurrent") Integer maxConcurrent) {
    return new Expert(
        id,
        name,
        expertiseTags,
        skillRatings,
        available == null || available,
        currentLoad == null ? 0 : currentLoad,
        maxConcurrent == null ? DEFAULT_MAX_CONCURRENT : maxConcurrent);
  }

  /** 新規割り当てを受けられるか。 */
  public boolean eligible() {
    return available && currentLoad < maxConcurrent;
  }

  public boolean atCapacity() {
    return currentLoad >= maxConcurrent;
  }

  public boolean holdsAny(Collection<String> tags) {
    for (String tag : tags) {
      if (expertiseTags.contains(tag)) {
        return true;
      }
    }
    return false;
  }

  /** 保有タグの評価値。評価未登録のタグは 0 として扱う。 */
  public int ratingFor(String tag) {
    return skillRatings.getOrDefault(tag, 0);
  }

  public Expert withCurrentLoad(int load) {
    return new Expert(id, name, expertiseTags, skillRatings, available, load, maxConcurrent);
  }

  public Expert withAvailable(boolean value) {
    return new Expert(id, name, expertiseTags, skillRatings, value, currentLoad, maxConcurrent);
  }

  private static Set<String> normalizeTags(Set<String> tags) {
    if (tags == null) {
      return Set.of();
    }
    return tags.stream()
        .filter(tag -> tag != null && !tag.isBlank())
        .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }

  private static Map<String, Integer> normalizeRatings(
      String id, Set<String> tags, Map<String, Integer> ratings) {
    if (ratings == null) {
      return Map.of();
    }
    final Map<String, Integer> normalized = new HashMap<>();
    for (Map.Entry<String, Integer> entry : ratings.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      final String tag = entry.getKey().trim().toLowerCase(Locale.ROOT);
      // 保有していないタグの評価は持たない
      if (!tags.contains(tag)) {
        continue;
      }
      final int rating = entry.getValue();
      if (rating < MIN_RATING || rating > MAX_RATING) {
        throw new IllegalArgumentException(
            "skill rating out of range expertId=" + id + " tag=" + tag + " rating=" + rating);
      }
      normalized.put(tag, rating);
    }
    return Map.copyOf(normalized);
  }
}
