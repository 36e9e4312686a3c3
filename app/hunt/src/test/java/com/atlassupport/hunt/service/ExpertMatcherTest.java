package com.atlassupport.hunt.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.model.PriorityLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpertMatcherTest {

  private final ExpertMatcher matcher = new ExpertMatcher();

  @Test
  void ranksByScoreForStandardRequest() {
    final List<Expert> experts =
        List.of(
            expert("e2", Map.of("vpn", 3), true, 0, 2),
            expert("e1", Map.of("vpn", 5), true, 0, 3));

    assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.STANDARD))
        .containsExactly("e1", "e2");
  }

  @Test
  void returnsEmptyWhenNobodyHoldsRequiredTag() {
    final List<Expert> experts = List.of(expert("e1", Map.of("vpn", 5), true, 0, 3));

    assertThat(matcher.rank(Set.of("mainframe"), experts, PriorityLevel.VIP)).isEmpty();
    assertThat(matcher.rank(Set.of(), experts, PriorityLevel.VIP)).isEmpty();
  }

  @Test
  void breaksScoreTiesByLoadThenId() {
    final List<Expert> experts =
        List.of(
            expert("c", Map.of("vpn", 4), true, 1, 3),
            expert("b", Map.of("vpn", 4), true, 0, 3),
            expert("a", Map.of("vpn", 4), true, 1, 3));

    assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.REGULAR))
        .containsExactly("b", "a", "c");
  }

  @Test
  void sumsRatingsAcrossMatchedTagsAndNormalizesRequiredTags() {
    final List<Expert> experts =
        List.of(
            expert("single", Map.of("vpn", 5), true, 0, 3),
            expert("double", Map.of("vpn", 3, "network", 3), true, 0, 3));

    assertThat(matcher.rank(List.of(" VPN ", "Network"), experts, PriorityLevel.REGULAR))
        .containsExactly("double", "single");
  }

  @Test
  void excludesIneligibleExpertsForNonVipRequests() {
    final List<Expert> experts =
        List.of(
            expert("full", Map.of("vpn", 5), true, 2, 2),
            expert("away", Map.of("vpn", 5), false, 0, 3),
            expert("free", Map.of("vpn", 1), true, 0, 3));

    assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.STANDARD))
        .containsExactly("free");
  }

  @Test
  void vipRequestKeepsFullExpertAfterUnderCapacityPeer() {
    final List<Expert> experts =
        List.of(
            expert("full", Map.of("vpn", 4), true, 3, 3),
            expert("open", Map.of("vpn", 4), true, 1, 3));

    assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.VIP))
        .containsExactly("open", "full");
    assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.STANDARD))
        .containsExactly("open");
  }

  @Test
  void vipRequestNeverIncludesUnavailableHolders() {
    final List<Expert> experts =
        List.of(
            expert("away", Map.of("vpn", 5), false, 0, 3),
            expert("away-full", Map.of("vpn", 4), false, 3, 3),
            expert("full", Map.of("vpn", 1), true, 3, 3));

    assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.VIP)).containsExactly("full");
  }

  @Test
  void rankingIsIndependentOfInputOrder() {
    final List<Expert> experts = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      experts.add(expert("e" + i, Map.of("vpn", 1 + i % 5), i % 7 != 0, i % 3, 3));
    }
    final List<String> expected = matcher.rank(Set.of("vpn"), experts, PriorityLevel.VIP);

    final Random random = new Random(42);
    for (int round = 0; round < 10; round++) {
      Collections.shuffle(experts, random);
      assertThat(matcher.rank(Set.of("vpn"), experts, PriorityLevel.VIP)).isEqualTo(expected);
    }
  }

  @Test
  void scoreCountsOnlyRequiredTags() {
    final Expert expert = expert("e1", Map.of("vpn", 5, "email", 2), true, 0, 3);

    assertThat(ExpertMatcher.score(expert, Set.of("vpn"))).isEqualTo(5);
    assertThat(ExpertMatcher.score(expert, Set.of("vpn", "email"))).isEqualTo(7);
    assertThat(ExpertMatcher.score(expert, Set.of("sso"))).isZero();
  }

  private static Expert expert(
      String id, Map<String, Integer> ratings, boolean available, int load, int max) {
    return new Expert(id, id, ratings.keySet(), ratings, available, load, max);
  }
}
