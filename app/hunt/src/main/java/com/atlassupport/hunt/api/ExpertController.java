package com.atlassupport.hunt.api;

import com.atlassupport.hunt.api.request.ExpertAvailabilityRequest;
import com.atlassupport.hunt.api.response.ExpertAvailabilityResponse;
import com.atlassupport.hunt.service.ExpertAvailabilityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/experts")
@RequiredArgsConstructor
public class ExpertController {

  private final ExpertAvailabilityService availabilityService;

  @PutMapping("/{expertId}/availability")
  public ResponseEntity<ExpertAvailabilityResponse> updateAvailability(
      @PathVariable("expertId") String expertId,
      @Valid @RequestBody ExpertAvailabilityRequest request) {
    return ResponseEntity.ok(availabilityService.setAvailability(expertId, request.available()));
  }
}
