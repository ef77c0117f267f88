package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * One analog of a target date. Rank 1 is the best analog.
 */
public record Analog(
        @JsonProperty("date") LocalDateTime date,
        @JsonProperty("value") Double value,
        @JsonProperty("criteria") Double criteria,
        @JsonProperty("rank") int rank) {
}
