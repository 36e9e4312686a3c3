package com.atlassupport.hunt.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class ClassificationTest {

  @Test
  void clampsScoreAndNormalizesTags() {
    final Classification classification =
        new Classification(140, Set.of(" VPN", ""), null, " ");

    assertThat(classification.urgencyScore()).isEqualTo(Classification.MAX_URGENCY);
    assertThat(classification.expertiseTags()).containsExactly("vpn");
    assertThat(classification.category()).isEqualTo(RequestCategory.OTHER);
    assertThat(classification.draftReply()).isNotBlank();
    assertThat(new Classification(-5, null, null, null).urgencyScore()).isZero();
  }

  @Test
  void fallbackIsMostUrgentWithoutTags() {
    final Classification fallback = Classification.fallback();

    assertThat(fallback.urgencyScore()).isEqualTo(100);
    assertThat(fallback.expertiseTags()).isEmpty();
    assertThat(fallback.category()).isEqualTo(RequestCategory.OTHER);
  }
}
