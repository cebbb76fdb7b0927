package com.ruteberegner.distance.application.service;

import com.ruteberegner.distance.application.port.in.ResolveDistanceUseCase;
import com.ruteberegner.distance.application.port.out.GeocodingGateway;
import com.ruteberegner.distance.application.port.out.RoutingGateway;
import com.ruteberegner.distance.domain.model.Coordinates;
import com.ruteberegner.distance.domain.model.DistanceResult;
import com.ruteberegner.distance.domain.model.DistanceSource;
import com.ruteberegner.distance.domain.model.Facility;
import com.ruteberegner.distance.domain.model.LocationRole;
import com.ruteberegner.distance.domain.model.LocationToken;
import com.ruteberegner.distance.domain.model.ResolvedLocation;
import com.ruteberegner.distance.domain.service.GeodesicDistanceCalculator;
import com.ruteberegner.distance.domain.service.LocationFormatResolver;
import com.ruteberegner.distance.domain.service.LocationFormatResolver.InvalidLocationException;
import com.ruteberegner.distance.infrastructure.cache.GeocodeCache;
import com.ruteberegner.distance.infrastructure.cache.LruCache;
import com.ruteberegner.distance.infrastructure.cache.RouteCache;
import com.ruteberegner.distance.infrastructure.retry.RetryConfig;
import com.ruteberegner.distance.infrastructure.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Application service resolving location pairs to travel distances.
 *
 * Strategy per endpoint: coordinate literal → used as is; identifier → facility address;
 * address → geocode cache → geocoding service → populate cache.
 * Strategy per pair: route cache → routed distance (with retry) → geodesic fallback → populate cache.
 *
 * Caches are only touched in memory; network calls run outside any cache lock,
 * so concurrent callers may resolve the same key twice and the last write wins.
 * The route cache stores bare distances, so the tier that produced each one is
 * kept in a separate map under the same key.
 */
@Service
public class DistanceResolutionService implements ResolveDistanceUseCase {

  private static final Logger logger = LoggerFactory.getLogger(DistanceResolutionService.class);

  private final LocationFormatResolver locationFormatResolver;
  private final GeocodingGateway geocodingGateway;
  private final RoutingGateway routingGateway;
  private final GeodesicDistanceCalculator geodesicDistanceCalculator;
  private final GeocodeCache geocodeCache;
  private final RouteCache routeCache;
  private final LruCache<String, DistanceSource> routeProvenance;
  private final RetryPolicy geocodingRetryPolicy;
  private final RetryPolicy routingRetryPolicy;
  private final String countryHint;
  private final List<String> countryAliases;

  public DistanceResolutionService(
      LocationFormatResolver locationFormatResolver,
      GeocodingGateway geocodingGateway,
      RoutingGateway routingGateway,
      GeodesicDistanceCalculator geodesicDistanceCalculator,
      GeocodeCache geocodeCache,
      RouteCache routeCache,
      @Qualifier(RetryConfig.GEOCODING) RetryPolicy geocodingRetryPolicy,
      @Qualifier(RetryConfig.ROUTING) RetryPolicy routingRetryPolicy,
      @Value("${app.geocoding.country-hint:Denmark}") String countryHint,
      @Value("${app.geocoding.country-aliases:denmark,danmark}") String countryAliases) {
    this.locationFormatResolver = locationFormatResolver;
    this.geocodingGateway = geocodingGateway;
    this.routingGateway = routingGateway;
    this.geodesicDistanceCalculator = geodesicDistanceCalculator;
    this.geocodeCache = geocodeCache;
    this.routeCache = routeCache;
    this.routeProvenance = new LruCache<>("route-provenance", routeCache.capacity());
    this.geocodingRetryPolicy = geocodingRetryPolicy;
    this.routingRetryPolicy = routingRetryPolicy;
    this.countryHint = countryHint == null ? "" : countryHint.trim();
    this.countryAliases = Arrays.stream(countryAliases.split(","))
        .map(alias -> alias.trim().toLowerCase(Locale.ROOT))
        .filter(alias -> !alias.isEmpty())
        .toList();
  }

  /**
   * Resolve two raw tokens to a distance. Both endpoints are classified before any
   * network call, so malformed input fails fast.
   *
   * @throws InvalidLocationException if either token is empty or an invalid coordinate literal
   * @throws GeocodingFailedException if either endpoint cannot be turned into coordinates
   * @throws DistanceResolutionException if no tier produced a positive distance
   */
  @Override
  public DistanceResult resolveDistance(String originToken, String destinationToken) {
    LocationToken origin = classify(originToken, LocationRole.ORIGIN);
    LocationToken destination = classify(destinationToken, LocationRole.DESTINATION);

    ResolvedLocation from = resolve(origin, LocationRole.ORIGIN);
    ResolvedLocation to = resolve(destination, LocationRole.DESTINATION);

    return resolveDistance(from.getCoordinates(), to.getCoordinates());
  }

  /**
   * Resolve the distance between two coordinates.
   * Strategy: route cache → routed lookup (retried) → geodesic fallback
   */
  @Override
  public DistanceResult resolveDistance(Coordinates origin, Coordinates destination) {
    String routeKey = RouteCache.cacheKey(origin, destination);
    Optional<Double> cached = routeCache.getDistance(origin, destination);
    if (cached.isPresent()) {
      DistanceSource computedBy = routeProvenance.get(routeKey).orElse(null);
      logger.debug("Route cache hit: {} -> {} (computed by {})", origin, destination, computedBy);
      return DistanceResult.cached(cached.get(), computedBy);
    }

    Optional<Double> routed = attemptRoutedDistance(origin, destination);
    if (routed.isPresent()) {
      cacheDistance(origin, destination, routeKey, routed.get(), DistanceSource.ROUTED);
      return DistanceResult.routed(routed.get());
    }

    double geodesicKm = geodesicDistanceCalculator.distanceKm(origin, destination);
    if (!isValidDistance(geodesicKm)) {
      logger.error("Geodesic fallback produced invalid distance {} for {} -> {}", geodesicKm, origin, destination);
      throw new DistanceResolutionException(
          "Could not resolve a positive distance between " + origin.toLiteral() + " and " + destination.toLiteral());
    }

    cacheDistance(origin, destination, routeKey, geodesicKm, DistanceSource.GEODESIC);
    logger.info("Geodesic distance: {} km", String.format(Locale.ROOT, "%.2f", geodesicKm));
    return DistanceResult.geodesic(geodesicKm);
  }

  @Override
  public ResolvedLocation resolveLocation(String token, LocationRole role) {
    return resolve(classify(token, role), role);
  }

  private LocationToken classify(String token, LocationRole role) {
    try {
      return locationFormatResolver.classify(token);
    } catch (InvalidLocationException e) {
      logger.debug("Invalid {} location '{}': {}", role.label(), token, e.getMessage());
      throw e.forRole(role);
    }
  }

  private ResolvedLocation resolve(LocationToken token, LocationRole role) {
    return switch (token.getFormat()) {
      case COORDINATES -> new ResolvedLocation(token, token.getCoordinates(), token.getCoordinates().toLiteral(), null);
      case IDENTIFIER -> resolveFacility(token, role);
      case ADDRESS -> new ResolvedLocation(token, geocode(token.getRaw(), role), token.getRaw(), null);
    };
  }

  private ResolvedLocation resolveFacility(LocationToken token, LocationRole role) {
    Facility facility = token.getFacility();
    if (facility == null) {
      throw new GeocodingFailedException(role, token.getRaw(), FailureReason.UNKNOWN_FACILITY,
          "Unknown facility identifier '" + token.getFacilityId() + "'", null);
    }
    String facilityAddress = facility.getFullAddress();
    logger.debug("Facility {} resolved to '{}'", token.getFacilityId(), facilityAddress);
    return new ResolvedLocation(token, geocode(facilityAddress, role), facilityAddress, facility.getName());
  }

  /**
   * Geocode an address: cache-first, then the geocoding service. The cache is keyed
   * on the caller's address, without the country hint.
   */
  private Coordinates geocode(String address, LocationRole role) {
    Optional<Coordinates> cached = geocodeCache.getCoordinates(address);
    if (cached.isPresent()) {
      logger.debug("Geocode cache hit for '{}'", address);
      return cached.get();
    }

    String searchAddress = withCountryHint(address);
    Optional<Coordinates> result;
    try {
      result = geocodingRetryPolicy.execute("geocode", () -> geocodingGateway.geocode(searchAddress));
    } catch (RuntimeException e) {
      logger.error("Geocoding failed for {} '{}': {}", role.label(), address, e.getMessage());
      throw new GeocodingFailedException(role, address, FailureReason.SERVICE_ERROR,
          "Geocoding service error: " + e.getMessage(), e);
    }

    if (result == null || result.isEmpty()) {
      logger.warn("No geocoding match for {} '{}'", role.label(), address);
      throw new GeocodingFailedException(role, address, FailureReason.NO_MATCH,
          "No geocoding match for '" + address + "'", null);
    }

    Coordinates coordinates = result.get();
    geocodeCache.setCoordinates(address, coordinates);
    logger.info("Geocoded {} '{}' to {}", role.label(), address, coordinates);
    return coordinates;
  }

  /**
   * Routed tier. Any failure, empty answer or non-positive distance yields empty so the
   * caller falls back to the geodesic tier.
   */
  private Optional<Double> attemptRoutedDistance(Coordinates origin, Coordinates destination) {
    try {
      Optional<Double> routed = routingRetryPolicy.execute("route",
          () -> routingGateway.route(origin, destination));
      if (routed == null || routed.isEmpty()) {
        logger.warn("Routing service returned no route for {} -> {}, using geodesic fallback", origin, destination);
        return Optional.empty();
      }
      if (!isValidDistance(routed.get())) {
        logger.warn("Routing service returned invalid distance {} for {} -> {}, using geodesic fallback",
            routed.get(), origin, destination);
        return Optional.empty();
      }
      return routed;
    } catch (RuntimeException e) {
      logger.warn("Routed distance failed, using geodesic fallback: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private void cacheDistance(Coordinates origin, Coordinates destination, String routeKey, double distanceKm,
      DistanceSource computedBy) {
    routeProvenance.set(routeKey, computedBy);
    routeCache.setDistance(origin, destination, distanceKm);
  }

  private String withCountryHint(String address) {
    if (countryHint.isEmpty()) {
      return address;
    }
    String lower = address.toLowerCase(Locale.ROOT);
    for (String alias : countryAliases) {
      if (lower.contains(alias)) {
        return address;
      }
    }
    return address + ", " + countryHint;
  }

  private static boolean isValidDistance(double distanceKm) {
    return distanceKm > 0.0 && !Double.isInfinite(distanceKm);
  }

  /**
   * Why an endpoint could not be turned into coordinates.
   */
  public enum FailureReason {
    UNKNOWN_FACILITY,
    NO_MATCH,
    SERVICE_ERROR
  }

  /**
   * Exception thrown when one endpoint cannot be geocoded.
   */
  public static class GeocodingFailedException extends RuntimeException {
    private final LocationRole role;
    private final String location;
    private final FailureReason reason;

    public GeocodingFailedException(LocationRole role, String location, FailureReason reason, String message,
        Throwable cause) {
      super("Could not geocode " + role.label() + ": " + message, cause);
      this.role = role;
      this.location = location;
      this.reason = reason;
    }

    public LocationRole getRole() {
      return role;
    }

    public String getLocation() {
      return location;
    }

    public FailureReason getReason() {
      return reason;
    }
  }

  /**
   * Exception thrown when every tier produced an invalid distance.
   */
  public static class DistanceResolutionException extends RuntimeException {
    public DistanceResolutionException(String message) {
      super(message);
    }
  }
}
