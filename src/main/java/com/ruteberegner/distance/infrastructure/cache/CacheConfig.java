package com.ruteberegner.distance.infrastructure.cache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process cache configuration.
 *
 * One geocode cache and one route cache per application context. Capacities are
 * fixed at construction; changing them means restarting with new settings.
 */
@Configuration
public class CacheConfig {

    @Bean
    public GeocodeCache geocodeCache(@Value("${app.cache.geocode-capacity:1000}") int capacity) {
        return new GeocodeCache(capacity);
    }

    @Bean
    public RouteCache routeCache(@Value("${app.cache.route-capacity:1000}") int capacity) {
        return new RouteCache(capacity);
    }
}
