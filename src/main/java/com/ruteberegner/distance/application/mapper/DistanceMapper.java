package com.ruteberegner.distance.application.mapper;

import com.ruteberegner.distance.api.dto.BatchDistanceEntryDto;
import com.ruteberegner.distance.api.dto.DistanceResponseDto;
import com.ruteberegner.distance.api.dto.LocationClassificationDto;
import com.ruteberegner.distance.domain.model.DistanceResult;
import com.ruteberegner.distance.domain.model.Facility;
import com.ruteberegner.distance.domain.model.LocationToken;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class DistanceMapper {

  public DistanceResponseDto toDto(String origin, String destination, DistanceResult result) {
    return new DistanceResponseDto(
        origin,
        destination,
        result.getDistanceKm(),
        result.getSource().label(),
        result.isEstimate());
  }

  public BatchDistanceEntryDto toBatchEntry(String origin, String destination, DistanceResult result) {
    return new BatchDistanceEntryDto(
        origin,
        destination,
        result.getDistanceKm(),
        result.getSource().label(),
        result.isEstimate(),
        null,
        null,
        null);
  }

  public BatchDistanceEntryDto toBatchError(String origin, String destination, String error, String endpoint,
      String message) {
    return new BatchDistanceEntryDto(origin, destination, null, null, null, error, endpoint, message);
  }

  /**
   * @param plausibleAddress advisory check result, only reported for address tokens
   */
  public LocationClassificationDto toClassificationDto(LocationToken token, boolean plausibleAddress) {
    LocationClassificationDto dto = new LocationClassificationDto();
    dto.setToken(token.getRaw());
    dto.setFormat(token.getFormat().name().toLowerCase(Locale.ROOT));
    switch (token.getFormat()) {
      case COORDINATES -> {
        dto.setLat(token.getCoordinates().getLat());
        dto.setLng(token.getCoordinates().getLng());
      }
      case IDENTIFIER -> {
        dto.setFacilityId(token.getFacilityId());
        Facility facility = token.getFacility();
        if (facility != null) {
          dto.setFacilityName(facility.getName());
          dto.setAddress(facility.getFullAddress());
        }
      }
      case ADDRESS -> {
        dto.setAddress(token.getRaw());
        dto.setPlausibleAddress(plausibleAddress);
      }
    }
    return dto;
  }
}
