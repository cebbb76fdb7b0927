package com.ruteberegner.distance.infrastructure.cache;

import com.ruteberegner.distance.domain.model.Coordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;

/**
 * Cache of resolved distances keyed by an unordered coordinate pair.
 *
 * Key rule: both coordinates rounded to 6 decimal places (~10 cm), then sorted,
 * so A→B and B→A share one entry. Stores whichever distance was last computed;
 * provenance is not recorded.
 */
public class RouteCache extends LruCache<String, Double> {

    private static final Logger logger = LoggerFactory.getLogger(RouteCache.class);

    private static final int DECIMAL_PLACES = 6;

    public RouteCache(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public RouteCache(int capacity, Clock clock) {
        super("route", capacity, clock);
        logger.info("RouteCache initialized with capacity={}", capacity);
    }

    public Optional<Double> getDistance(Coordinates from, Coordinates to) {
        return get(cacheKey(from, to));
    }

    public void setDistance(Coordinates from, Coordinates to, double distanceKm) {
        set(cacheKey(from, to), distanceKm);
    }

    /**
     * Direction-independent key for a coordinate pair, also used to track data kept alongside the cache.
     */
    public static String cacheKey(Coordinates from, Coordinates to) {
        BigDecimal[] first = rounded(from);
        BigDecimal[] second = rounded(to);
        if (compare(first, second) > 0) {
            BigDecimal[] swap = first;
            first = second;
            second = swap;
        }
        return "route_" + first[0].toPlainString() + "," + first[1].toPlainString()
            + "_to_" + second[0].toPlainString() + "," + second[1].toPlainString();
    }

    private static BigDecimal[] rounded(Coordinates coordinates) {
        return new BigDecimal[] {
            BigDecimal.valueOf(coordinates.getLat()).setScale(DECIMAL_PLACES, RoundingMode.HALF_UP),
            BigDecimal.valueOf(coordinates.getLng()).setScale(DECIMAL_PLACES, RoundingMode.HALF_UP)
        };
    }

    private static int compare(BigDecimal[] a, BigDecimal[] b) {
        int byLat = a[0].compareTo(b[0]);
        return byLat != 0 ? byLat : a[1].compareTo(b[1]);
    }
}
