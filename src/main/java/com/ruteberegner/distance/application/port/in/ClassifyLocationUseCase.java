package com.ruteberegner.distance.application.port.in;

import com.ruteberegner.distance.api.dto.LocationClassificationDto;

/**
 * Input port for inspecting how a raw location token is interpreted, without geocoding it.
 */
public interface ClassifyLocationUseCase {

  LocationClassificationDto classify(String token);
}
