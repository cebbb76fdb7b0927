package com.ruteberegner.distance.domain.model;

import java.util.Locale;

/**
 * Provenance of a resolved distance.
 */
public enum DistanceSource {
    /** Road-network distance from the routing service. */
    ROUTED,
    /** Straight-line fallback; callers should label it as an estimate. */
    GEODESIC,
    /** Served from the route cache; the original tier is tracked separately. */
    CACHE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
