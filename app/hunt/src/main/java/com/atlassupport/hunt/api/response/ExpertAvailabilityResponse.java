package com.atlassupport.hunt.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExpertAvailabilityResponse(
    String expertId, boolean available, int currentLoad, int maxConcurrent) {}
