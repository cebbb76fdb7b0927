package com.ruteberegner.distance.infrastructure.persistence;

import com.ruteberegner.distance.domain.model.Facility;
import com.ruteberegner.distance.domain.repository.FacilityDirectory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * JPA implementation of the FacilityDirectory port.
 */
@Repository
public interface FacilityJpaRepository extends JpaRepository<Facility, UUID>, FacilityDirectory {

    @Override
    Optional<Facility> findByFacilityId(String facilityId);

    @Override
    boolean existsByFacilityId(String facilityId);
}
