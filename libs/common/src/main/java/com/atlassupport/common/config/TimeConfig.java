/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: Hunt の締切計算とテストの固定時刻を同じ注入経路で扱うため
 */
package com.atlassupport.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
