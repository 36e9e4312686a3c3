/*
 * どこで: Hunt インフラ設定
 * 何を: Wave 締切の起床に使う TaskScheduler と、チケット/専門家単位のロックを提供する
 * なぜ: Hunt ごとにスレッドを占有せず、少数スレッドのタイマーで多数の Hunt を待機させるため
 */
package com.atlassupport.hunt.config;

import com.google.common.util.concurrent.Striped;
import java.util.concurrent.locks.Lock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class HuntSchedulerConfig {

  @Bean(destroyMethod = "shutdown")
  ThreadPoolTaskScheduler huntTaskScheduler(HuntProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.schedulerPoolSize());
    scheduler.setThreadNamePrefix("hunt-wave-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  HuntLocks huntLocks(HuntProperties properties) {
    return new HuntLocks(
        Striped.lock(properties.lockStripes()), Striped.lock(properties.lockStripes()));
  }

  /**
   * チケット単位と専門家単位の排他スコープ。
   *
   * <p>両方を取る場合は必ず ticket → expert の順で取得する。
   */
  public record HuntLocks(Striped<Lock> tickets, Striped<Lock> experts) {

    public Lock ticket(String ticketId) {
      return tickets.get(ticketId);
    }

    public Lock expert(String expertId) {
      return experts.get(expertId);
    }
  }
}
