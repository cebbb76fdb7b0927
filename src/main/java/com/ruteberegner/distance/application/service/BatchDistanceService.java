package com.ruteberegner.distance.application.service;

import com.ruteberegner.distance.api.dto.BatchDistanceEntryDto;
import com.ruteberegner.distance.api.dto.BatchDistanceResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.application.mapper.DistanceMapper;
import com.ruteberegner.distance.application.port.in.RecomputeDistancesUseCase;
import com.ruteberegner.distance.application.port.in.ResolveDistanceUseCase;
import com.ruteberegner.distance.application.service.DistanceResolutionService.DistanceResolutionException;
import com.ruteberegner.distance.application.service.DistanceResolutionService.GeocodingFailedException;
import com.ruteberegner.distance.domain.model.DistanceResult;
import com.ruteberegner.distance.domain.service.LocationFormatResolver.InvalidLocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Application service for "recompute all" requests: resolves each row on its own,
 * sequentially, sharing the caches with single lookups.
 */
@Service
public class BatchDistanceService implements RecomputeDistancesUseCase {

  private static final Logger logger = LoggerFactory.getLogger(BatchDistanceService.class);

  private final ResolveDistanceUseCase resolveDistanceUseCase;
  private final DistanceMapper distanceMapper;

  public BatchDistanceService(ResolveDistanceUseCase resolveDistanceUseCase, DistanceMapper distanceMapper) {
    this.resolveDistanceUseCase = resolveDistanceUseCase;
    this.distanceMapper = distanceMapper;
  }

  @Override
  public BatchDistanceResponseDto recompute(List<DistanceQueryDto> pairs) {
    List<BatchDistanceEntryDto> results = new ArrayList<>(pairs.size());
    int resolved = 0;

    for (DistanceQueryDto pair : pairs) {
      if (pair == null) {
        results.add(distanceMapper.toBatchError(null, null, "INVALID_INPUT", null, "Pair must not be null"));
        continue;
      }
      String origin = pair.getOrigin();
      String destination = pair.getDestination();
      try {
        DistanceResult result = resolveDistanceUseCase.resolveDistance(origin, destination);
        results.add(distanceMapper.toBatchEntry(origin, destination, result));
        resolved++;
      } catch (InvalidLocationException e) {
        results.add(distanceMapper.toBatchError(origin, destination, "INVALID_INPUT",
            e.getRole() != null ? e.getRole().label() : null, e.getMessage()));
      } catch (GeocodingFailedException e) {
        results.add(distanceMapper.toBatchError(origin, destination, "GEOCODING_FAILED",
            e.getRole().label(), e.getMessage()));
      } catch (DistanceResolutionException e) {
        results.add(distanceMapper.toBatchError(origin, destination, "DISTANCE_UNRESOLVED", null, e.getMessage()));
      }
    }

    int failed = pairs.size() - resolved;
    logger.info("Batch recompute complete: {} resolved, {} failed", resolved, failed);
    return new BatchDistanceResponseDto(pairs.size(), resolved, failed, results);
  }
}
