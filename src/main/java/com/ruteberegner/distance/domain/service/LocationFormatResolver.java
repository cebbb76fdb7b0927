package com.ruteberegner.distance.domain.service;

import com.ruteberegner.distance.domain.model.Coordinates;
import com.ruteberegner.distance.domain.model.Facility;
import com.ruteberegner.distance.domain.model.LocationRole;
import com.ruteberegner.distance.domain.model.LocationToken;
import com.ruteberegner.distance.domain.repository.FacilityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Domain service classifying raw location tokens.
 *
 * Classification order:
 * 1. Coordinate literal: two plain numbers separated by a comma ("56.4167,10.7833"),
 *    or two unsigned numbers with hemisphere letters ("56.4167 N, 10.7833 E")
 * 2. Identifier: purely numeric, or short alphanumeric text known to the facility directory
 * 3. Address: everything else
 *
 * Coordinate-shaped input outside the valid range is rejected, never reinterpreted as an address.
 */
@Service
public class LocationFormatResolver {

    private static final Logger logger = LoggerFactory.getLogger(LocationFormatResolver.class);

    static final int MAX_IDENTIFIER_LENGTH = 10;
    static final int MIN_ADDRESS_LENGTH = 5;
    static final int MAX_ADDRESS_LENGTH = 200;

    private static final String UNSIGNED_NUMBER = "(?:\\d+(?:\\.\\d*)?|\\.\\d+)";
    private static final String SIGNED_NUMBER = "[+-]?" + UNSIGNED_NUMBER;

    private static final Pattern COORDINATE_PATTERN = Pattern.compile(
        "^\\s*(" + SIGNED_NUMBER + ")\\s*,\\s*(" + SIGNED_NUMBER + ")\\s*$");

    private static final Pattern HEMISPHERE_PATTERN = Pattern.compile(
        "^\\s*(" + UNSIGNED_NUMBER + ")\\s*°?\\s*([NS])\\s*,\\s*(" + UNSIGNED_NUMBER + ")\\s*°?\\s*([EW])\\s*$",
        Pattern.CASE_INSENSITIVE);

    // Anything that looks like a hemisphere literal; used to reject the malformed variants.
    private static final Pattern HEMISPHERE_LIKE_PATTERN = Pattern.compile(
        "^\\s*" + SIGNED_NUMBER + "\\s*°?\\s*[NSEW]\\s*,\\s*" + SIGNED_NUMBER + "\\s*°?\\s*[NSEW]\\s*$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC_PATTERN = Pattern.compile("^\\d+$");
    private static final Pattern ALPHANUMERIC_PATTERN = Pattern.compile("^[\\p{L}\\p{N}]+$");
    private static final Pattern LETTER_PATTERN = Pattern.compile("[a-zA-ZæøåÆØÅ]");
    private static final Pattern DIGIT_PATTERN = Pattern.compile("\\d");

    private final FacilityDirectory facilityDirectory;

    public LocationFormatResolver(FacilityDirectory facilityDirectory) {
        this.facilityDirectory = facilityDirectory;
    }

    /**
     * Classifies a raw token and parses it according to its format.
     * May consult the facility directory for short alphanumeric tokens.
     *
     * @param token Raw location text
     * @return Classified token
     * @throws InvalidLocationException if the token is empty or an out-of-range coordinate literal
     */
    public LocationToken classify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidLocationException("Location must not be empty");
        }
        String trimmed = token.trim();

        Optional<Coordinates> coordinates = parseCoordinateLiteral(trimmed);
        if (coordinates.isPresent()) {
            logger.debug("Classified '{}' as coordinates {}", trimmed, coordinates.get());
            return LocationToken.ofCoordinates(trimmed, coordinates.get());
        }

        if (NUMERIC_PATTERN.matcher(trimmed).matches()) {
            Facility facility = lookupFacility(trimmed).orElse(null);
            if (facility == null) {
                logger.debug("Numeric identifier '{}' is not in the facility directory", trimmed);
            }
            return LocationToken.ofIdentifier(trimmed, trimmed, facility);
        }

        if (looksLikeShortIdentifier(trimmed)) {
            Optional<Facility> facility = lookupFacility(trimmed);
            if (facility.isPresent()) {
                logger.debug("Classified '{}' as facility identifier", trimmed);
                return LocationToken.ofIdentifier(trimmed, trimmed, facility.get());
            }
        }

        logger.debug("Classified '{}' as address", trimmed);
        return LocationToken.ofAddress(trimmed);
    }

    /**
     * Parses a coordinate literal.
     *
     * @return Coordinates, or empty if the text is not coordinate-shaped
     * @throws InvalidLocationException if the text is coordinate-shaped but out of range or malformed
     */
    public Optional<Coordinates> parseCoordinateLiteral(String text) {
        if (text == null) {
            return Optional.empty();
        }

        Matcher plain = COORDINATE_PATTERN.matcher(text);
        if (plain.matches()) {
            return Optional.of(toCoordinates(text, Double.parseDouble(plain.group(1)), Double.parseDouble(plain.group(2))));
        }

        Matcher hemisphere = HEMISPHERE_PATTERN.matcher(text);
        if (hemisphere.matches()) {
            double lat = Double.parseDouble(hemisphere.group(1));
            double lng = Double.parseDouble(hemisphere.group(3));
            if (hemisphere.group(2).toUpperCase(Locale.ROOT).equals("S")) {
                lat = -lat;
            }
            if (hemisphere.group(4).toUpperCase(Locale.ROOT).equals("W")) {
                lng = -lng;
            }
            return Optional.of(toCoordinates(text, lat, lng));
        }

        if (HEMISPHERE_LIKE_PATTERN.matcher(text).matches()) {
            throw new InvalidLocationException(
                "Malformed coordinates '" + text + "': expected unsigned latitude with N/S followed by longitude with E/W");
        }
        return Optional.empty();
    }

    /**
     * Advisory plausibility check for free-text addresses: reasonable length,
     * at least one letter and one digit. Resolution does not depend on it.
     */
    public boolean isPlausibleAddress(String address) {
        if (address == null) {
            return false;
        }
        String trimmed = address.trim();
        if (trimmed.length() < MIN_ADDRESS_LENGTH || trimmed.length() > MAX_ADDRESS_LENGTH) {
            return false;
        }
        return LETTER_PATTERN.matcher(trimmed).find() && DIGIT_PATTERN.matcher(trimmed).find();
    }

    private boolean looksLikeShortIdentifier(String trimmed) {
        return trimmed.length() <= MAX_IDENTIFIER_LENGTH
            && ALPHANUMERIC_PATTERN.matcher(trimmed.replace(" ", "")).matches();
    }

    /**
     * Directory failures fall through to address interpretation.
     */
    private Optional<Facility> lookupFacility(String facilityId) {
        try {
            return facilityDirectory.findByFacilityId(facilityId);
        } catch (RuntimeException e) {
            logger.warn("Facility lookup failed for '{}', treating as unknown: {}", facilityId, e.getMessage());
            return Optional.empty();
        }
    }

    private Coordinates toCoordinates(String text, double lat, double lng) {
        if (!Coordinates.isValid(lat, lng)) {
            throw new InvalidLocationException(
                "Coordinates out of range in '" + text + "': latitude must be within [-90, 90] and longitude within [-180, 180]");
        }
        return new Coordinates(lat, lng);
    }

    /**
     * Exception thrown for location input that can be rejected without any network call.
     */
    public static class InvalidLocationException extends IllegalArgumentException {
        private final LocationRole role;

        public InvalidLocationException(String message) {
            this(null, message, null);
        }

        public InvalidLocationException(LocationRole role, String message, Throwable cause) {
            super(message, cause);
            this.role = role;
        }

        /**
         * Side of the query the input belonged to, or null if not yet known.
         */
        public LocationRole getRole() {
            return role;
        }

        public InvalidLocationException forRole(LocationRole role) {
            return new InvalidLocationException(role, role.label() + ": " + getMessage(), this);
        }
    }
}
