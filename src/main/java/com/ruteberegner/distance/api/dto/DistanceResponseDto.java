package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
/**
 * Distance between two locations. {@code estimate} is null when a cached value's origin is no longer known.
 */
public class DistanceResponseDto {

    @JsonProperty("origin")
    private String origin;

    @JsonProperty("destination")
    private String destination;

    @JsonProperty("distanceKm")
    private Double distanceKm;

    @JsonProperty("source")
    private String source;

    @JsonProperty("estimate")
    private Boolean estimate;
}
