package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record AnalogDatesResponse(
        @JsonProperty("parameters") Parameters parameters,
        @JsonProperty("analog_dates") List<LocalDateTime> analogDates) {
}
