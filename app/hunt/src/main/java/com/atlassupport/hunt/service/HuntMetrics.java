package com.atlassupport.hunt.service;

import com.atlassupport.hunt.model.ClaimResult;
import com.atlassupport.hunt.model.HuntOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class HuntMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer timeToClaimTimer;
  private final Counter huntStartedCounter;
  private final Counter waveCounter;
  private final Counter notifyFailureCounter;
  private final Counter classifierFallbackCounter;
  private final AtomicLong activeHunts = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> claimResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();

  public HuntMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.timeToClaimTimer =
        Timer.builder("hunt.time_to_claim")
            .description("Time from ticket creation to an accepted claim")
            .register(meterRegistry);
    this.huntStartedCounter = Counter.builder("hunt.started.total").register(meterRegistry);
    this.waveCounter = Counter.builder("hunt.wave.total").register(meterRegistry);
    this.notifyFailureCounter =
        Counter.builder("hunt.notify.failure.total").register(meterRegistry);
    this.classifierFallbackCounter =
        Counter.builder("hunt.classifier.fallback.total").register(meterRegistry);
    Gauge.builder("hunt.active", activeHunts, AtomicLong::get).register(meterRegistry);
  }

  public void recordHuntStarted() {
    huntStartedCounter.increment();
  }

  public void recordWave() {
    waveCounter.increment();
  }

  public void recordNotifyFailure() {
    notifyFailureCounter.increment();
  }

  public void recordClassifierFallback() {
    classifierFallbackCounter.increment();
  }

  public void updateActiveHunts(long count) {
    activeHunts.set(Math.max(0, count));
  }

  public void recordClaimResult(ClaimResult result) {
    claimResultCounters
        .computeIfAbsent(result.name().toLowerCase(Locale.ROOT), this::registerClaimCounter)
        .increment();
  }

  public void recordOutcome(HuntOutcome outcome) {
    outcomeCounters
        .computeIfAbsent(outcome.name().toLowerCase(Locale.ROOT), this::registerOutcomeCounter)
        .increment();
  }

  public void recordTimeToClaim(Duration elapsed) {
    if (elapsed.isNegative()) {
      return;
    }
    timeToClaimTimer.record(elapsed);
  }

  private Counter registerClaimCounter(String result) {
    return Counter.builder("hunt.claim.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerOutcomeCounter(String outcome) {
    return Counter.builder("hunt.outcome.total")
        .tags(Tags.of("outcome", outcome))
        .register(meterRegistry);
  }
}
