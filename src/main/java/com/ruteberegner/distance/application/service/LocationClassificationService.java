package com.ruteberegner.distance.application.service;

import com.ruteberegner.distance.api.dto.LocationClassificationDto;
import com.ruteberegner.distance.application.mapper.DistanceMapper;
import com.ruteberegner.distance.application.port.in.ClassifyLocationUseCase;
import com.ruteberegner.distance.domain.model.LocationToken;
import com.ruteberegner.distance.domain.service.LocationFormatResolver;
import org.springframework.stereotype.Service;

@Service
public class LocationClassificationService implements ClassifyLocationUseCase {

  private final LocationFormatResolver locationFormatResolver;
  private final DistanceMapper distanceMapper;

  public LocationClassificationService(LocationFormatResolver locationFormatResolver, DistanceMapper distanceMapper) {
    this.locationFormatResolver = locationFormatResolver;
    this.distanceMapper = distanceMapper;
  }

  @Override
  public LocationClassificationDto classify(String token) {
    LocationToken classified = locationFormatResolver.classify(token);
    boolean plausible = classified.isAddress() && locationFormatResolver.isPlausibleAddress(classified.getRaw());
    return distanceMapper.toClassificationDto(classified, plausible);
  }
}
