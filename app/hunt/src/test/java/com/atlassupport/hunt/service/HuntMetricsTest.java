package com.atlassupport.hunt.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.atlassupport.hunt.model.ClaimResult;
import com.atlassupport.hunt.model.HuntOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class HuntMetricsTest {

  @Test
  void recordsCountersGaugeAndTimer() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HuntMetrics metrics = new HuntMetrics(registry);

    metrics.recordHuntStarted();
    metrics.recordWave();
    metrics.recordWave();
    metrics.recordNotifyFailure();
    metrics.recordClassifierFallback();
    metrics.updateActiveHunts(4);
    metrics.recordClaimResult(ClaimResult.ACCEPTED);
    metrics.recordClaimResult(ClaimResult.ALREADY_CLAIMED);
    metrics.recordClaimResult(ClaimResult.ALREADY_CLAIMED);
    metrics.recordOutcome(HuntOutcome.EXPIRED);
    metrics.recordTimeToClaim(Duration.ofSeconds(42));

    assertThat(registry.get("hunt.started.total").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("hunt.wave.total").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("hunt.notify.failure.total").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("hunt.classifier.fallback.total").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("hunt.active").gauge().value()).isEqualTo(4.0);
    assertThat(registry.get("hunt.claim.total").tag("result", "accepted").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("hunt.claim.total").tag("result", "already_claimed").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("hunt.outcome.total").tag("outcome", "expired").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("hunt.time_to_claim").timer().count()).isEqualTo(1L);
  }

  @Test
  void ignoresNegativeTimeToClaimAndClampsGauge() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HuntMetrics metrics = new HuntMetrics(registry);

    metrics.recordTimeToClaim(Duration.ofSeconds(-1));
    metrics.updateActiveHunts(-3);

    assertThat(registry.get("hunt.time_to_claim").timer().count()).isZero();
    assertThat(registry.get("hunt.active").gauge().value()).isZero();
  }
}
