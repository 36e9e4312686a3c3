package com.atlassupport.hunt.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atlassupport.hunt.api.ExpertNotFoundException;
import com.atlassupport.hunt.api.InvalidSupportRequestException;
import com.atlassupport.hunt.api.response.ExpertAvailabilityResponse;
import com.atlassupport.hunt.config.HuntSchedulerConfig.HuntLocks;
import com.atlassupport.hunt.model.PriorityLevel;
import com.atlassupport.hunt.testing.InMemoryExpertDirectory;
import com.google.common.util.concurrent.Striped;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpertAvailabilityServiceTest {

  private final InMemoryExpertDirectory directory = new InMemoryExpertDirectory();
  private final ExpertAvailabilityService service =
      new ExpertAvailabilityService(directory, new HuntLocks(Striped.lock(4), Striped.lock(4)));

  @Test
  void togglesAvailabilityAndKeepsLoad() {
    directory.addExpert("e1", Set.of("vpn"), 4, 2, 3);

    final ExpertAvailabilityResponse response = service.setAvailability("e1", false);

    assertThat(response).isEqualTo(new ExpertAvailabilityResponse("e1", false, 2, 3));
    assertThat(directory.expert("e1").available()).isFalse();
    assertThat(directory.expert("e1").eligible()).isFalse();
  }

  @Test
  void unavailableExpertDropsOutOfStandardRanking() {
    directory.addExpert("e1", Set.of("vpn"), 4, 0, 3);
    service.setAvailability("e1", false);

    assertThat(
            new ExpertMatcher()
                .rank(Set.of("vpn"), directory.listExperts(), PriorityLevel.STANDARD))
        .isEmpty();
  }

  @Test
  void rejectsUnknownExpertAndMissingFlag() {
    assertThatThrownBy(() -> service.setAvailability("ghost", true))
        .isInstanceOf(ExpertNotFoundException.class);
    assertThatThrownBy(() -> service.setAvailability("e1", null))
        .isInstanceOf(InvalidSupportRequestException.class);
  }
}
