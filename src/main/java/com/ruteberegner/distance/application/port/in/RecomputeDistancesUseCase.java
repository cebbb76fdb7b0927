package com.ruteberegner.distance.application.port.in;

import com.ruteberegner.distance.api.dto.BatchDistanceResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;

import java.util.List;

/**
 * Input port for resolving many origin/destination pairs in one call.
 */
public interface RecomputeDistancesUseCase {

  /**
   * Resolve every pair independently. A failing pair is reported in its own entry
   * and does not abort the rest.
   */
  BatchDistanceResponseDto recompute(List<DistanceQueryDto> pairs);
}
