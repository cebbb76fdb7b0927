package com.ruteberegner.distance.infrastructure.cache;

import com.ruteberegner.distance.domain.model.Coordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Cache of geocoding results: normalized address → coordinates.
 * Does not geocode by itself.
 */
public class GeocodeCache extends LruCache<String, Coordinates> {

    private static final Logger logger = LoggerFactory.getLogger(GeocodeCache.class);

    static final int MAX_PLAIN_KEY_LENGTH = 100;
    private static final String KEY_PREFIX = "addr_";

    public GeocodeCache(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public GeocodeCache(int capacity, Clock clock) {
        super("geocode", capacity, clock);
        logger.info("GeocodeCache initialized with capacity={}", capacity);
    }

    public Optional<Coordinates> getCoordinates(String address) {
        return get(cacheKey(address));
    }

    public void setCoordinates(String address, double lat, double lng) {
        set(cacheKey(address), new Coordinates(lat, lng));
    }

    public void setCoordinates(String address, Coordinates coordinates) {
        set(cacheKey(address), coordinates);
    }

    /**
     * Lower-cased, trimmed, whitespace-collapsed address. Normalized addresses longer
     * than 100 characters are replaced by their SHA-256 digest.
     */
    static String cacheKey(String address) {
        String normalized = String.join(" ", address.toLowerCase(Locale.ROOT).trim().split("\\s+"));
        if (normalized.length() > MAX_PLAIN_KEY_LENGTH) {
            return KEY_PREFIX + sha256Hex(normalized);
        }
        return KEY_PREFIX + normalized;
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
