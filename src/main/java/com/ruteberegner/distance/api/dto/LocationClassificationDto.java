package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * How a raw token was interpreted. {@code plausibleAddress} is advisory only.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationClassificationDto {

    @JsonProperty("token")
    private String token;

    @JsonProperty("format")
    private String format;

    @JsonProperty("lat")
    private Double lat;

    @JsonProperty("lng")
    private Double lng;

    @JsonProperty("facilityId")
    private String facilityId;

    @JsonProperty("facilityName")
    private String facilityName;

    @JsonProperty("address")
    private String address;

    @JsonProperty("plausibleAddress")
    private Boolean plausibleAddress;
}
