package com.ruteberegner.distance.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruteberegner.distance.application.port.out.GeocodingGateway;
import com.ruteberegner.distance.domain.model.Coordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Optional;

/**
 * Geocoding adapter for the Nominatim search API.
 * Handles request building, the HTTP call and response parsing.
 */
@Service
public class NominatimGeocodingClient implements GeocodingGateway {

    private static final Logger logger = LoggerFactory.getLogger(NominatimGeocodingClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final int timeoutSeconds;

    public NominatimGeocodingClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.geocoding.api-url}") String apiUrl,
        @Value("${app.geocoding.user-agent:RuteBeregner/1.0}") String userAgent,
        @Value("${app.geocoding.timeout-seconds:10}") int timeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = webClientBuilder.clone()
            .baseUrl(apiUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
            .build();
    }

    /**
     * Geocode an address, taking the first (best) match.
     *
     * @param address Free-form address
     * @return Coordinates of the best match, or empty if Nominatim found nothing
     * @throws GeocodingServiceException if the call fails, times out or the response is unreadable
     */
    @Override
    public Optional<Coordinates> geocode(String address) {
        logger.debug("Geocoding address: '{}'", address);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/search")
                    .queryParam("q", address)
                    .queryParam("format", "jsonv2")
                    .queryParam("limit", 1)
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();
        } catch (WebClientResponseException e) {
            logger.error("Nominatim returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new GeocodingServiceException("Nominatim returned " + e.getStatusCode(), e);
        } catch (WebClientException e) {
            logger.error("Failed to connect to Nominatim", e);
            throw new GeocodingServiceException("Failed to connect to Nominatim", e);
        } catch (Exception e) {
            logger.error("Unexpected error querying Nominatim for '{}'", address, e);
            throw new GeocodingServiceException("Unexpected error querying Nominatim", e);
        }

        Optional<Coordinates> result = parseResponse(responseBody);
        if (result.isPresent()) {
            logger.info("Geocoded '{}' to {}", address, result.get());
        } else {
            logger.warn("Nominatim returned no result for '{}'", address);
        }
        return result;
    }

    /**
     * Parse the Nominatim JSON array. Matches with out-of-range coordinates are treated as no result.
     */
    private Optional<Coordinates> parseResponse(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "[]" : responseBody);
        } catch (Exception e) {
            logger.error("Failed to parse Nominatim response", e);
            throw new GeocodingServiceException("Failed to parse Nominatim response", e);
        }

        if (root == null || !root.isArray() || root.isEmpty()) {
            return Optional.empty();
        }

        JsonNode best = root.get(0);
        JsonNode lat = best.get("lat");
        JsonNode lon = best.get("lon");
        if (lat == null || lon == null) {
            logger.warn("Nominatim result missing lat/lon: {}", best);
            return Optional.empty();
        }

        try {
            double latitude = Double.parseDouble(lat.asText());
            double longitude = Double.parseDouble(lon.asText());
            if (!Coordinates.isValid(latitude, longitude)) {
                logger.warn("Nominatim returned out-of-range coordinates: {},{}", latitude, longitude);
                return Optional.empty();
            }
            return Optional.of(new Coordinates(latitude, longitude));
        } catch (NumberFormatException e) {
            logger.warn("Nominatim returned non-numeric coordinates: {}", best);
            return Optional.empty();
        }
    }
}
