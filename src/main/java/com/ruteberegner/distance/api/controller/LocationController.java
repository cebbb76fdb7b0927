package com.ruteberegner.distance.api.controller;

import com.ruteberegner.distance.api.dto.LocationClassificationDto;
import com.ruteberegner.distance.application.port.in.ClassifyLocationUseCase;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/locations")
public class LocationController {

    private final ClassifyLocationUseCase classifyLocationUseCase;

    public LocationController(ClassifyLocationUseCase classifyLocationUseCase) {
        this.classifyLocationUseCase = classifyLocationUseCase;
    }

    /**
     * GET /locations/classify?token=X
     */
    @GetMapping("/classify")
    public ResponseEntity<LocationClassificationDto> classify(@RequestParam("token") String token) {
        return ResponseEntity.ok(classifyLocationUseCase.classify(token));
    }
}
