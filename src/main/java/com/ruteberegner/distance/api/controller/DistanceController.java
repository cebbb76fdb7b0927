package com.ruteberegner.distance.api.controller;

import com.ruteberegner.distance.api.dto.BatchDistanceRequestDto;
import com.ruteberegner.distance.api.dto.BatchDistanceResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.api.dto.DistanceResponseDto;
import com.ruteberegner.distance.application.mapper.DistanceMapper;
import com.ruteberegner.distance.application.port.in.RecomputeDistancesUseCase;
import com.ruteberegner.distance.application.port.in.ResolveDistanceUseCase;
import com.ruteberegner.distance.domain.model.DistanceResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for distance lookups.
 * Resolves location pairs using cached geocoding, routed distance and a geodesic fallback.
 */
@RestController
@RequestMapping("/distances")
@Validated
public class DistanceController {

    private static final Logger logger = LoggerFactory.getLogger(DistanceController.class);

    private final ResolveDistanceUseCase resolveDistanceUseCase;
    private final RecomputeDistancesUseCase recomputeDistancesUseCase;
    private final DistanceMapper distanceMapper;

    public DistanceController(
            ResolveDistanceUseCase resolveDistanceUseCase,
            RecomputeDistancesUseCase recomputeDistancesUseCase,
            DistanceMapper distanceMapper) {
        this.resolveDistanceUseCase = resolveDistanceUseCase;
        this.recomputeDistancesUseCase = recomputeDistancesUseCase;
        this.distanceMapper = distanceMapper;
    }

    /**
     * GET /distances?origin=X&destination=Y
     *
     * @param query Origin and destination tokens
     * @return Distance in kilometres with its source (routed/geodesic/cache)
     */
    @GetMapping
    public ResponseEntity<DistanceResponseDto> getDistance(@Valid @ModelAttribute DistanceQueryDto query) {
        logger.info("Resolving distance: origin='{}', destination='{}'", query.getOrigin(), query.getDestination());

        DistanceResult result = resolveDistanceUseCase.resolveDistance(query.getOrigin(), query.getDestination());
        return ResponseEntity.ok(distanceMapper.toDto(query.getOrigin(), query.getDestination(), result));
    }

    /**
     * POST /distances/batch
     *
     * Resolve every pair; failures are reported per entry.
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchDistanceResponseDto> recompute(@Valid @RequestBody BatchDistanceRequestDto request) {
        logger.info("Recomputing {} distance pairs", request.getPairs().size());
        return ResponseEntity.ok(recomputeDistancesUseCase.recompute(request.getPairs()));
    }
}
