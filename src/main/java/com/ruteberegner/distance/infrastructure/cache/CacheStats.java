package com.ruteberegner.distance.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time snapshot of an {@link LruCache}'s counters.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class CacheStats {

    @JsonProperty("size")
    private final int size;

    @JsonProperty("capacity")
    private final int capacity;

    @JsonProperty("hits")
    private final long hits;

    @JsonProperty("misses")
    private final long misses;

    @JsonProperty("totalRequests")
    private final long totalRequests;

    @JsonProperty("hitRatePercent")
    private final double hitRatePercent;

    @JsonProperty("uptimeSeconds")
    private final double uptimeSeconds;
}
