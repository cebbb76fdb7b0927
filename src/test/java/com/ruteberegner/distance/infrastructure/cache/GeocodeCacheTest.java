package com.ruteberegner.distance.infrastructure.cache;

import com.ruteberegner.distance.domain.model.Coordinates;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeocodeCacheTest {

    @Test
    void keyIgnoresCaseAndSurroundingWhitespace() {
        GeocodeCache cache = new GeocodeCache(10);
        cache.setCoordinates("Rugvænget 18, 8444 Grenå", 56.4158, 10.8783);

        assertThat(cache.getCoordinates("  rugvænget 18,   8444 GRENÅ ")).contains(new Coordinates(56.4158, 10.8783));
    }

    @Test
    void shortAddressesKeepReadableKeys() {
        assertThat(GeocodeCache.cacheKey("Strømmen 38, 8900 Randers")).isEqualTo("addr_strømmen 38, 8900 randers");
    }

    @Test
    void longAddressesAreHashed() {
        String longAddress = "Vej ".repeat(40) + "1, 8000 Aarhus";

        String key = GeocodeCache.cacheKey(longAddress);

        assertThat(key).startsWith("addr_");
        assertThat(key.substring("addr_".length())).hasSize(64).matches("[0-9a-f]+");
        assertThat(GeocodeCache.cacheKey(longAddress.toUpperCase())).isEqualTo(key);
    }

    @Test
    void rejectsOutOfRangeCoordinates() {
        GeocodeCache cache = new GeocodeCache(10);

        assertThatThrownBy(() -> cache.setCoordinates("Somewhere 1", 91.0, 10.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    void missIsCounted() {
        GeocodeCache cache = new GeocodeCache(10);

        assertThat(cache.getCoordinates("Unknown 1")).isEmpty();
        assertThat(cache.stats().getMisses()).isEqualTo(1);
    }
}
