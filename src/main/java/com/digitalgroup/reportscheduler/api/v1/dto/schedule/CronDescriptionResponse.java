package com.digitalgroup.reportscheduler.api.v1.dto.schedule;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronDescriptionResponse(String expression, boolean valid, String description,
                                      String timezone, List<Instant> nextRuns, String error) {
}
