package com.ruteberegner.distance.application.port.out;

import com.ruteberegner.distance.domain.model.Coordinates;

import java.util.Optional;

/**
 * Output port for the external road-routing service.
 */
public interface RoutingGateway {

  /**
   * Request the routed distance between two coordinates, one request per pair.
   *
   * @return Distance in kilometers, or empty when the service found no usable route
   * @throws RoutingServiceException on timeout, HTTP error or unreadable response
   */
  Optional<Double> route(Coordinates from, Coordinates to);

  /**
   * Raised when the routing service call failed. The original client exception is kept as cause.
   */
  class RoutingServiceException extends RuntimeException {
    public RoutingServiceException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
