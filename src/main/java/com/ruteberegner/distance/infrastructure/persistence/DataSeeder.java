package com.ruteberegner.distance.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruteberegner.distance.domain.model.Facility;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Seeds the facility table from a JSON resource.
 * Runs when app.seeding.enabled=true; existing identifiers are left untouched.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedFacilities(
        FacilityJpaRepository facilityRepository,
        ObjectMapper objectMapper,
        @Value("${app.seeding.facilities:classpath:seed/facilities.json}") Resource facilitiesResource
    ) {
        return args -> {
            if (!facilitiesResource.exists()) {
                logger.warn("Facility seed file {} not found, skipping", facilitiesResource.getDescription());
                return;
            }

            List<FacilitySeed> seeds;
            try (InputStream in = facilitiesResource.getInputStream()) {
                seeds = objectMapper.readValue(in, new TypeReference<List<FacilitySeed>>() { });
            } catch (IOException e) {
                throw new IllegalStateException("Could not read facility seed file " + facilitiesResource.getDescription(), e);
            }

            int created = 0;
            for (FacilitySeed seed : seeds) {
                if (seed.getFacilityId() == null || seed.getFacilityId().isBlank()) {
                    logger.warn("Skipping facility seed without id: {}", seed.getName());
                    continue;
                }
                if (facilityRepository.existsByFacilityId(seed.getFacilityId())) {
                    logger.debug("Facility {} already exists, skipping", seed.getFacilityId());
                    continue;
                }
                facilityRepository.save(new Facility(
                    seed.getFacilityId().trim(),
                    seed.getName(),
                    seed.getStreet(),
                    seed.getPostalCode(),
                    seed.getCity()));
                created++;
            }

            logger.info("Facility seeding complete: {} created, {} total", created, facilityRepository.count());
        };
    }

    /**
     * Shape of one entry in the seed file.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    static class FacilitySeed {
        private String facilityId;
        private String name;
        private String street;
        private String postalCode;
        private String city;
    }
}
