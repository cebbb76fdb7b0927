package com.ruteberegner.distance.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

/**
 * Value object representing a geographic coordinate pair in decimal degrees.
 */
@Getter
@EqualsAndHashCode
public class Coordinates {
    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    private final double lat;
    private final double lng;

    public Coordinates(double lat, double lng) {
        if (!isValid(lat, lng)) {
            if (Double.isNaN(lat) || lat < MIN_LATITUDE || lat > MAX_LATITUDE) {
                throw new IllegalArgumentException("Latitude must be between -90 and 90, got " + lat);
            }
            throw new IllegalArgumentException("Longitude must be between -180 and 180, got " + lng);
        }
        this.lat = lat;
        this.lng = lng;
    }

    public static Coordinates of(double lat, double lng) {
        return new Coordinates(lat, lng);
    }

    /**
     * Range check without constructing an instance. NaN is never valid.
     */
    public static boolean isValid(double lat, double lng) {
        return lat >= MIN_LATITUDE && lat <= MAX_LATITUDE
            && lng >= MIN_LONGITUDE && lng <= MAX_LONGITUDE;
    }

    /**
     * Serializes as the {@code "lat,lng"} literal accepted by the location parser.
     */
    public String toLiteral() {
        return String.format(Locale.ROOT, "%s,%s", lat, lng);
    }

    @Override
    public String toString() {
        return "Coordinates(" + toLiteral() + ")";
    }
}
