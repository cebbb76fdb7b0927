package com.ruteberegner.distance.domain.model;

import java.util.Locale;

/**
 * Which side of a distance query a location belongs to. Used to attribute failures.
 */
public enum LocationRole {
    ORIGIN,
    DESTINATION;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
