package com.ruteberegner.distance.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A caller-supplied location after classification.
 *
 * <p>Exactly one interpretation is populated: {@link #getCoordinates()} for
 * coordinate literals, {@link #getFacilityId()} (and the facility, when the
 * directory knows it) for identifiers, and just the raw text for addresses.</p>
 */
@Getter
@ToString
public class LocationToken {
    private final LocationFormat format;
    private final String raw;
    private final Coordinates coordinates;
    private final String facilityId;
    private final Facility facility;

    private LocationToken(
            LocationFormat format,
            String raw,
            Coordinates coordinates,
            String facilityId,
            Facility facility
    ) {
        this.format = Objects.requireNonNull(format, "format");
        this.raw = Objects.requireNonNull(raw, "raw");
        this.coordinates = coordinates;
        this.facilityId = facilityId;
        this.facility = facility;
    }

    public static LocationToken ofCoordinates(String raw, Coordinates coordinates) {
        return new LocationToken(LocationFormat.COORDINATES, raw, Objects.requireNonNull(coordinates, "coordinates"), null, null);
    }

    /**
     * Identifier token. {@code facility} is null when the directory has no entry for the id.
     */
    public static LocationToken ofIdentifier(String raw, String facilityId, Facility facility) {
        return new LocationToken(LocationFormat.IDENTIFIER, raw, null, Objects.requireNonNull(facilityId, "facilityId"), facility);
    }

    public static LocationToken ofAddress(String raw) {
        return new LocationToken(LocationFormat.ADDRESS, raw, null, null, null);
    }

    public boolean isCoordinates() {
        return format == LocationFormat.COORDINATES;
    }

    public boolean isIdentifier() {
        return format == LocationFormat.IDENTIFIER;
    }

    public boolean isAddress() {
        return format == LocationFormat.ADDRESS;
    }
}
