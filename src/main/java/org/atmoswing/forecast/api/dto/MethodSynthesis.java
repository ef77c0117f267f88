package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record MethodSynthesis(
        @JsonProperty("method_id") String methodId,
        @JsonProperty("target_dates") List<LocalDateTime> targetDates,
        @JsonProperty("values") List<Double> values) {
}
