package com.ruteberegner.distance.infrastructure.cache;

import com.ruteberegner.distance.domain.model.Coordinates;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RouteCacheTest {

    private static final Coordinates COPENHAGEN = new Coordinates(55.6761, 12.5683);
    private static final Coordinates GRENAA = new Coordinates(56.4167, 10.8833);

    @Test
    void keyIsIndependentOfDirection() {
        assertThat(RouteCache.cacheKey(COPENHAGEN, GRENAA)).isEqualTo(RouteCache.cacheKey(GRENAA, COPENHAGEN));
    }

    @Test
    void keyUsesSixDecimalsInSortedOrder() {
        assertThat(RouteCache.cacheKey(GRENAA, COPENHAGEN))
                .isEqualTo("route_55.676100,12.568300_to_56.416700,10.883300");
    }

    @Test
    void coordinatesEqualAfterRoundingShareAnEntry() {
        RouteCache cache = new RouteCache(10);
        cache.setDistance(COPENHAGEN, GRENAA, 157.3);

        Coordinates nearlyGrenaa = new Coordinates(56.41670004, 10.88329996);

        assertThat(cache.getDistance(nearlyGrenaa, COPENHAGEN)).contains(157.3);
    }

    @Test
    void reverseLookupHitsAndCounts() {
        RouteCache cache = new RouteCache(10);
        cache.setDistance(COPENHAGEN, GRENAA, 157.3);

        assertThat(cache.getDistance(GRENAA, COPENHAGEN)).contains(157.3);
        assertThat(cache.stats().getHits()).isEqualTo(1);
    }
}
