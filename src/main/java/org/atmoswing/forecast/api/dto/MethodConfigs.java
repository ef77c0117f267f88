package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MethodConfigs(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("configurations") List<MethodInfo> configurations) {
}
