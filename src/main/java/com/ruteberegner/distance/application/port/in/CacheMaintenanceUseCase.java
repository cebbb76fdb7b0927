package com.ruteberegner.distance.application.port.in;

import com.ruteberegner.distance.api.dto.CacheWarmupResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.infrastructure.cache.CacheStats;

import java.util.List;
import java.util.Map;

/**
 * Input port for inspecting and maintaining the geocode and route caches.
 */
public interface CacheMaintenanceUseCase {

  /**
   * Statistics keyed by cache name ({@code geocode}, {@code route}).
   */
  Map<String, CacheStats> cacheStatistics();

  /**
   * Drop every entry from both caches and reset their counters.
   */
  void clearAllCaches();

  /**
   * Pre-populate the geocode cache with the endpoints of the given routes.
   * Failures are counted, never propagated.
   */
  CacheWarmupResponseDto warmUp(List<DistanceQueryDto> routes);
}
