package com.ruteberegner.distance.api.controller;

import com.ruteberegner.distance.api.dto.CacheWarmupResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.application.port.in.CacheMaintenanceUseCase;
import com.ruteberegner.distance.infrastructure.cache.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Controller for cache inspection and maintenance.
 */
@RestController
@RequestMapping("/cache")
public class CacheController {

    private static final Logger logger = LoggerFactory.getLogger(CacheController.class);

    private final CacheMaintenanceUseCase cacheMaintenanceUseCase;

    public CacheController(CacheMaintenanceUseCase cacheMaintenanceUseCase) {
        this.cacheMaintenanceUseCase = cacheMaintenanceUseCase;
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, CacheStats>> getStats() {
        return ResponseEntity.ok(cacheMaintenanceUseCase.cacheStatistics());
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        logger.info("Clearing caches on request");
        cacheMaintenanceUseCase.clearAllCaches();
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /cache/warm
     *
     * Body: list of {origin, destination} pairs whose endpoints should be geocoded ahead of time.
     */
    @PostMapping("/warm")
    public ResponseEntity<CacheWarmupResponseDto> warm(@RequestBody List<DistanceQueryDto> routes) {
        logger.info("Warming caches from {} routes", routes.size());
        return ResponseEntity.ok(cacheMaintenanceUseCase.warmUp(routes));
    }
}
