package org.atmoswing.forecast.infrastructure.cache.warm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * On-disk form of a prebuilt result. Timestamps are ISO-8601 instants.
 */
public record WarmCacheEntry(
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("source_watermark") String sourceWatermark,
        @JsonProperty("result") JsonNode result) {
}
