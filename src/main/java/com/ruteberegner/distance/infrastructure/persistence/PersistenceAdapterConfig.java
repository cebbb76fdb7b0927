package com.ruteberegner.distance.infrastructure.persistence;

import com.ruteberegner.distance.domain.repository.FacilityDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the JPA repository to the FacilityDirectory port.
 */
@Configuration
public class PersistenceAdapterConfig {

    @Bean
    @Primary
    public FacilityDirectory facilityDirectory(FacilityJpaRepository jpaRepository) {
        return jpaRepository;
    }
}
