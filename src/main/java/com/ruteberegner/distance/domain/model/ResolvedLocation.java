package com.ruteberegner.distance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A location token resolved to coordinates, keeping what is needed for display.
 */
@Getter
@ToString
@AllArgsConstructor
public class ResolvedLocation {
    private final LocationToken token;
    private final Coordinates coordinates;
    /** Text that was geocoded, or the coordinate literal. */
    private final String address;
    /** Facility name for identifier tokens, otherwise null. */
    private final String displayName;
}
