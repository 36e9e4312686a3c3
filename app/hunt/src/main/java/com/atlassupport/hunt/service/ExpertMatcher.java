/*
 * どこで: Hunt サービス層
 * 何を: 必要タグと専門家スナップショットから候補者の順位付けを行う
 * なぜ: 副作用のない純粋関数として切り出し、同一入力に対して常に同一順位を返すため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.model.PriorityLevel;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class ExpertMatcher {

  /**
   * 役割: 候補専門家の id を優先順に返す。
   * 動作: 必要タグを 1 つ以上持つ専門家のうち、割り当て可能な者を (スコア降順, 負荷昇順, id 昇順) で並べる。
   * VIP の場合は受付中だが満杯の保有者を同じ順序で末尾に追加する。不在の専門家は claim できないため含めない。
   * 前提: 該当者がいない場合は空リストを返す(エラーではなく、呼び出し側のフォールバック合図)。
   */
  public List<String> rank(
      Collection<String> requiredTags, Collection<Expert> experts, PriorityLevel priority) {
    final Set<String> tags = normalize(requiredTags);
    if (tags.isEmpty()) {
      return List.of();
    }
    final Comparator<Expert> order = rankingOrder(tags);
    final List<Expert> holders = experts.stream().filter(expert -> expert.holdsAny(tags)).toList();

    final List<String> ranked = new ArrayList<>();
    holders.stream().filter(Expert::eligible).sorted(order).map(Expert::id).forEach(ranked::add);
    if (priority == PriorityLevel.VIP) {
      // 候補ゼロで VIP を取り残さないための最終手段ティア
      holders.stream()
          .filter(expert -> expert.available() && expert.atCapacity())
          .sorted(order)
          .map(Expert::id)
          .forEach(ranked::add);
    }
    return List.copyOf(ranked);
  }

  /** 必要タグと保有タグの積集合に対する評価値の合計。 */
  static int score(Expert expert, Set<String> requiredTags) {
    int score = 0;
    for (String tag : requiredTags) {
      if (expert.expertiseTags().contains(tag)) {
        score += expert.ratingFor(tag);
      }
    }
    return score;
  }

  private Comparator<Expert> rankingOrder(Set<String> tags) {
    return Comparator.comparingInt((Expert expert) -> score(expert, tags))
        .reversed()
        .thenComparingInt(Expert::currentLoad)
        .thenComparing(Expert::id);
  }

  private Set<String> normalize(Collection<String> tags) {
    if (tags == null) {
      return Set.of();
    }
    return tags.stream()
        .filter(tag -> tag != null && !tag.isBlank())
        .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
