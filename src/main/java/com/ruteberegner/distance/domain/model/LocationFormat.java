package com.ruteberegner.distance.domain.model;

/**
 * Interpretation of a raw location token, decided by its shape.
 */
public enum LocationFormat {
    COORDINATES,
    IDENTIFIER,
    ADDRESS
}
