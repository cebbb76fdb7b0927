package com.ruteberegner.distance.application.service;

import com.ruteberegner.distance.api.dto.CacheWarmupResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.application.port.in.CacheMaintenanceUseCase;
import com.ruteberegner.distance.application.port.in.ResolveDistanceUseCase;
import com.ruteberegner.distance.domain.model.LocationRole;
import com.ruteberegner.distance.infrastructure.cache.CacheStats;
import com.ruteberegner.distance.infrastructure.cache.GeocodeCache;
import com.ruteberegner.distance.infrastructure.cache.RouteCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application service for cache statistics, clearing and warm-up.
 */
@Service
public class CacheMaintenanceService implements CacheMaintenanceUseCase {

  private static final Logger logger = LoggerFactory.getLogger(CacheMaintenanceService.class);

  private final GeocodeCache geocodeCache;
  private final RouteCache routeCache;
  private final ResolveDistanceUseCase resolveDistanceUseCase;

  public CacheMaintenanceService(
      GeocodeCache geocodeCache,
      RouteCache routeCache,
      ResolveDistanceUseCase resolveDistanceUseCase) {
    this.geocodeCache = geocodeCache;
    this.routeCache = routeCache;
    this.resolveDistanceUseCase = resolveDistanceUseCase;
  }

  @Override
  public Map<String, CacheStats> cacheStatistics() {
    Map<String, CacheStats> stats = new LinkedHashMap<>();
    stats.put(geocodeCache.name(), geocodeCache.stats());
    stats.put(routeCache.name(), routeCache.stats());
    return stats;
  }

  @Override
  public void clearAllCaches() {
    geocodeCache.clear();
    routeCache.clear();
    logger.info("All caches cleared");
  }

  /**
   * Geocode the origin and destination of every route so later distance lookups hit the cache.
   * Null routes are skipped and not counted as processed.
   */
  @Override
  public CacheWarmupResponseDto warmUp(List<DistanceQueryDto> routes) {
    int processed = 0;
    int geocoded = 0;
    int failed = 0;

    for (DistanceQueryDto route : routes) {
      if (route == null) {
        logger.warn("Cache warm-up skipped a null route");
        continue;
      }
      processed++;
      if (warm(route.getOrigin(), LocationRole.ORIGIN)) {
        geocoded++;
      } else if (route.getOrigin() != null && !route.getOrigin().isBlank()) {
        failed++;
      }
      if (warm(route.getDestination(), LocationRole.DESTINATION)) {
        geocoded++;
      } else if (route.getDestination() != null && !route.getDestination().isBlank()) {
        failed++;
      }
    }

    logger.info("Cache warm-up complete: {} locations geocoded from {} routes ({} failed)",
        geocoded, processed, failed);
    return new CacheWarmupResponseDto(processed, geocoded, failed);
  }

  private boolean warm(String token, LocationRole role) {
    if (token == null || token.isBlank()) {
      return false;
    }
    try {
      resolveDistanceUseCase.resolveLocation(token, role);
      return true;
    } catch (RuntimeException e) {
      logger.warn("Cache warm-up could not resolve {} '{}': {}", role.label(), token, e.getMessage());
      return false;
    }
  }
}
