package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An origin/destination pair of raw location tokens.
 * Each token may be an address, a "lat,lng" literal or a facility identifier.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class DistanceQueryDto {

    @NotBlank(message = "Origin is required")
    @JsonProperty("origin")
    private String origin;

    @NotBlank(message = "Destination is required")
    @JsonProperty("destination")
    private String destination;
}
