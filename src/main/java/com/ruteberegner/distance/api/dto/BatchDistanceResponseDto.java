package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BatchDistanceResponseDto {

    @JsonProperty("count")
    private int count;

    @JsonProperty("resolved")
    private int resolved;

    @JsonProperty("failed")
    private int failed;

    @JsonProperty("results")
    private List<BatchDistanceEntryDto> results;
}
