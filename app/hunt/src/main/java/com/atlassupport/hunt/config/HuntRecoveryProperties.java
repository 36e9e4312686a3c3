/*
 * どこで: Hunt 設定
 * 何を: 中断された Hunt を再開するワーカーの設定を保持する
 * なぜ: 再起動時の取りこぼし検出間隔を環境ごとに調整するため
 */
package com.atlassupport.hunt.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hunt.recovery")
public record HuntRecoveryProperties(boolean enabled, Duration interval) {}
