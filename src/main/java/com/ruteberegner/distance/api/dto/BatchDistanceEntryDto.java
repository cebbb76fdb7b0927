package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One row of a batch result: either a distance or an attributed error.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchDistanceEntryDto {

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

    @JsonProperty("error")
    private String error;

    @JsonProperty("endpoint")
    private String endpoint;

    @JsonProperty("message")
    private String message;
}
