package com.ruteberegner.distance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * DTO for recomputing distances for many rows at once.
 * Pair contents are not validated here; a blank token fails only its own row.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BatchDistanceRequestDto {

    @NotEmpty(message = "At least one pair is required")
    @JsonProperty("pairs")
    private List<DistanceQueryDto> pairs;
}
