package com.atlassupport.hunt.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpertTest {

  @Test
  void normalizesTagsAndDropsRatingsForUnheldTags() {
    final Expert expert =
        new Expert("e1", "Alex", Set.of(" VPN ", "Email"), Map.of("vpn", 5, "sso", 4), true, 0, 3);

    assertThat(expert.expertiseTags()).containsExactlyInAnyOrder("vpn", "email");
    assertThat(expert.skillRatings()).containsOnlyKeys("vpn");
    assertThat(expert.ratingFor("vpn")).isEqualTo(5);
    assertThat(expert.ratingFor("email")).isZero();
  }

  @Test
  void fromJsonAppliesDefaults() {
    final Expert expert = Expert.fromJson("e1", null, Set.of("vpn"), null, null, null, null);

    assertThat(expert.name()).isEqualTo("e1");
    assertThat(expert.available()).isTrue();
    assertThat(expert.currentLoad()).isZero();
    assertThat(expert.maxConcurrent()).isEqualTo(Expert.DEFAULT_MAX_CONCURRENT);
    assertThat(expert.eligible()).isTrue();
  }

  @Test
  void eligibilityFollowsAvailabilityAndLoad() {
    final Expert expert = new Expert("e1", "Alex", Set.of("vpn"), Map.of(), true, 1, 2);

    assertThat(expert.eligible()).isTrue();
    assertThat(expert.withCurrentLoad(2).eligible()).isFalse();
    assertThat(expert.withCurrentLoad(2).atCapacity()).isTrue();
    assertThat(expert.withAvailable(false).eligible()).isFalse();
  }

  @Test
  void rejectsInvalidRecords() {
    assertThatThrownBy(() -> new Expert(" ", "x", Set.of(), Map.of(), true, 0, 3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Expert("e1", "x", Set.of(), Map.of(), true, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Expert("e1", "x", Set.of(), Map.of(), true, 4, 3))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Expert("e1", "x", Set.of("vpn"), Map.of("vpn", 6), true, 0, 3))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("skill rating out of range");
  }
}
