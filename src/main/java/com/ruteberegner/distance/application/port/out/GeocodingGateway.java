package com.ruteberegner.distance.application.port.out;

import com.ruteberegner.distance.domain.model.Coordinates;

import java.util.Optional;

/**
 * Output port for the external address geocoding service.
 */
public interface GeocodingGateway {

  /**
   * Geocode a free-form address.
   *
   * @param address Address text, already carrying any country hint
   * @return Coordinates of the best match, or empty when the service has no match
   * @throws GeocodingServiceException on timeout, unavailability or any other service error
   */
  Optional<Coordinates> geocode(String address);

  /**
   * Raised when the geocoding service could not be queried or answered with an error.
   */
  class GeocodingServiceException extends RuntimeException {
    public GeocodingServiceException(String message) {
      super(message);
    }

    public GeocodingServiceException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
