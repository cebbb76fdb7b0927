package com.ruteberegner.distance.application.port.in;

import com.ruteberegner.distance.domain.model.Coordinates;
import com.ruteberegner.distance.domain.model.DistanceResult;
import com.ruteberegner.distance.domain.model.LocationRole;
import com.ruteberegner.distance.domain.model.ResolvedLocation;

/**
 * Input port for resolving travel distances between two locations.
 */
public interface ResolveDistanceUseCase {

  /**
   * Resolve two location tokens (addresses, coordinate literals or facility identifiers)
   * to a travel distance.
   * Strategy: geocode both ends (cache-first) → route cache → routed lookup → geodesic fallback
   *
   * @param originToken Raw origin token
   * @param destinationToken Raw destination token
   * @return Positive distance with its provenance
   */
  DistanceResult resolveDistance(String originToken, String destinationToken);

  /**
   * Resolve the distance between two already known coordinates.
   */
  DistanceResult resolveDistance(Coordinates origin, Coordinates destination);

  /**
   * Resolve a single location token to coordinates.
   *
   * @param token Raw token
   * @param role Side of the query, used to attribute failures
   */
  ResolvedLocation resolveLocation(String token, LocationRole role);
}
