package com.atlassupport.hunt.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class HuntPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "hunt.bot-name=Atlas Support",
              "hunt.fallback-channel=support-requests",
              "hunt.wave-timeout=5m",
              "hunt.max-wave-cycles=2",
              "hunt.rebroadcast-enabled=true",
              "hunt.high-urgency-threshold=80",
              "hunt.vip-wave-width=3",
              "hunt.hunt-expiry=30m",
              "hunt.escalation-threshold=50",
              "hunt.scheduler-pool-size=2",
              "hunt.lock-stripes=64",
              "hunt.recovery.enabled=true",
              "hunt.recovery.interval=30s",
              "hunt.storage.experts-path=data/experts.json",
              "hunt.storage.user-priorities-path=data/user_priorities.json",
              "hunt.storage.tickets-path=data/tickets.json");

  @Test
  void contextStartsAndBindsAllHuntSettings() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final HuntProperties hunt = context.getBean(HuntProperties.class);
          final HuntRecoveryProperties recovery = context.getBean(HuntRecoveryProperties.class);
          final HuntStorageProperties storage = context.getBean(HuntStorageProperties.class);

          assertThat(hunt.waveTimeout()).isEqualTo(Duration.ofMinutes(5));
          assertThat(hunt.huntExpiry()).isEqualTo(Duration.ofMinutes(30));
          assertThat(hunt.vipWaveWidth()).isEqualTo(3);
          assertThat(hunt.rebroadcastEnabled()).isTrue();
          assertThat(recovery.interval()).isEqualTo(Duration.ofSeconds(30));
          assertThat(storage.ticketsPath()).isEqualTo(Path.of("data/tickets.json"));
        });
  }

  @Test
  void contextFailsOnInvalidWaveTimeout() {
    contextRunner
        .withPropertyValues("hunt.wave-timeout=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    HuntProperties.class,
    HuntRecoveryProperties.class,
    HuntStorageProperties.class
  })
  static class TestConfiguration {}
}
