package org.atmoswing.forecast.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Id and display name of a method or of a configuration.
 */
public record MethodInfo(@JsonProperty("id") String id, @JsonProperty("name") String name) {
}
