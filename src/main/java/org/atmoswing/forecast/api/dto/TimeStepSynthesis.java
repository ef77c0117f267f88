package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Largest values of all methods sharing a time step (hours, 0 for single-date series).
 */
public record TimeStepSynthesis(
        @JsonProperty("time_step") int timeStep,
        @JsonProperty("target_dates") List<LocalDateTime> targetDates,
        @JsonProperty("values") List<Double> values) {
}
