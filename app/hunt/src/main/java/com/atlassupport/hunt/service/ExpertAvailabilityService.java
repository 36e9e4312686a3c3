/*
 * どこで: Hunt サービス層
 * 何を: 専門家の受付可否を切り替える
 * なぜ: 不在の専門家を以後の候補順位付けから外すため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.api.ExpertNotFoundException;
import com.atlassupport.hunt.api.InvalidSupportRequestException;
import com.atlassupport.hunt.api.response.ExpertAvailabilityResponse;
import com.atlassupport.hunt.config.HuntSchedulerConfig.HuntLocks;
import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.repository.ExpertDirectory;
import java.util.concurrent.locks.Lock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpertAvailabilityService {

  private static final Logger logger = LoggerFactory.getLogger(ExpertAvailabilityService.class);

  private final ExpertDirectory directory;
  private final HuntLocks locks;

  /** 実行中の Hunt の候補リストは作り直さない。claim 時の資格判定で反映される。 */
  public ExpertAvailabilityResponse setAvailability(String expertId, Boolean available) {
    if (expertId == null || expertId.isBlank()) {
      throw new InvalidSupportRequestException("expertId is required");
    }
    if (available == null) {
      throw new InvalidSupportRequestException("available is required");
    }
    final Expert saved;
    final Lock lock = locks.expert(expertId);
    lock.lock();
    try {
      final Expert expert =
          directory.findExpert(expertId).orElseThrow(() -> new ExpertNotFoundException(expertId));
      saved =
          expert.available() == available
              ? expert
              : directory.saveExpert(expert.withAvailable(available));
    } finally {
      lock.unlock();
    }
    logger.info("expert availability updated expertId={} available={}", expertId, available);
    return new ExpertAvailabilityResponse(
        saved.id(), saved.available(), saved.currentLoad(), saved.maxConcurrent());
  }
}
