/*
 * どこで: Hunt 設定
 * 何を: Wave 幅/締切/再送回数/フォールバック先などのエンジン設定を保持する
 * なぜ: 運用パラメータをコード外へ出し、起動時に妥当性を検証するため
 */
package com.atlassupport.hunt.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "hunt")
@Validated
public record HuntProperties(
    @NotBlank String botName,
    @NotBlank String fallbackChannel,
    @NotNull Duration waveTimeout,
    @Min(1) int maxWaveCycles,
    boolean rebroadcastEnabled,
    @Min(0) @Max(100) int highUrgencyThreshold,
    @Min(1) int vipWaveWidth,
    @NotNull Duration huntExpiry,
    @Min(0) @Max(100) int escalationThreshold,
    @Min(1) int schedulerPoolSize,
    @Min(1) int lockStripes) {

  @AssertTrue(message = "hunt.wave-timeout must be positive")
  public boolean isWaveTimeoutPositive() {
    return isPositiveDuration(waveTimeout);
  }

  @AssertTrue(message = "hunt.hunt-expiry must be positive")
  public boolean isHuntExpiryPositive() {
    return isPositiveDuration(huntExpiry);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
