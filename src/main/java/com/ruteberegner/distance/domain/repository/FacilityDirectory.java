package com.ruteberegner.distance.domain.repository;

import com.ruteberegner.distance.domain.model.Facility;

import java.util.Optional;

/**
 * Lookup table from short facility identifiers to facility records.
 * Treated as synchronous and side-effect free by the resolution engine.
 */
public interface FacilityDirectory {

  /**
   * Find a facility by its identifier (exact match).
   */
  Optional<Facility> findByFacilityId(String facilityId);

  /**
   * Check whether a facility identifier is known.
   */
  boolean existsByFacilityId(String facilityId);
}
