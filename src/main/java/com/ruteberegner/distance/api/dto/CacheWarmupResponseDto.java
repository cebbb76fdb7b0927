package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of a cache warm-up run.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CacheWarmupResponseDto {

    @JsonProperty("processed")
    private int processed;

    @JsonProperty("geocoded")
    private int geocoded;

    @JsonProperty("failed")
    private int failed;
}
