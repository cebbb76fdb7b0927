package com.ruteberegner.distance.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A positive distance in kilometers together with where it came from.
 *
 * <p>{@code computedBy} is the tier that originally produced the value: the same as
 * {@code source} for fresh results, and the recorded tier for cache hits (null when
 * it is no longer known).</p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class DistanceResult {
    private final double distanceKm;
    private final DistanceSource source;
    private final DistanceSource computedBy;

    public DistanceResult(double distanceKm, DistanceSource source, DistanceSource computedBy) {
        if (!(distanceKm > 0.0) || Double.isInfinite(distanceKm)) {
            throw new IllegalArgumentException("Distance must be a positive finite number, got " + distanceKm);
        }
        if (source == null) {
            throw new IllegalArgumentException("Distance source must not be null");
        }
        if (computedBy == DistanceSource.CACHE) {
            throw new IllegalArgumentException("A distance cannot be computed by the cache");
        }
        this.distanceKm = distanceKm;
        this.source = source;
        this.computedBy = computedBy;
    }

    public static DistanceResult routed(double distanceKm) {
        return new DistanceResult(distanceKm, DistanceSource.ROUTED, DistanceSource.ROUTED);
    }

    public static DistanceResult geodesic(double distanceKm) {
        return new DistanceResult(distanceKm, DistanceSource.GEODESIC, DistanceSource.GEODESIC);
    }

    /**
     * @param computedBy tier that produced the cached value, or null if unknown
     */
    public static DistanceResult cached(double distanceKm, DistanceSource computedBy) {
        return new DistanceResult(distanceKm, DistanceSource.CACHE, computedBy);
    }

    /**
     * Whether the value is a straight-line estimate. Null for a cache hit whose tier is unknown.
     */
    public Boolean isEstimate() {
        if (computedBy == null) {
            return null;
        }
        return computedBy == DistanceSource.GEODESIC;
    }
}
