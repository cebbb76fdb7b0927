package com.ruteberegner.distance.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruteberegner.distance.application.port.out.RoutingGateway;
import com.ruteberegner.distance.domain.model.Coordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Routing adapter for the OSRM route service.
 * One request per coordinate pair; no retries here, callers wrap the call in a retry policy.
 */
@Service
public class OsrmRoutingClient implements RoutingGateway {

    private static final Logger logger = LoggerFactory.getLogger(OsrmRoutingClient.class);

    // OSRM answers 400 with one of these codes when the coordinates cannot be routed
    private static final Set<String> NO_ROUTE_CODES = Set.of("NoRoute", "NoSegment");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String profile;
    private final int timeoutSeconds;

    public OsrmRoutingClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.routing.api-url}") String apiUrl,
        @Value("${app.routing.profile:driving}") String profile,
        @Value("${app.routing.timeout-seconds:10}") int timeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.profile = profile;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = webClientBuilder.clone()
            .baseUrl(apiUrl)
            .build();
    }

    /**
     * Query OSRM for the driving distance between two points.
     *
     * @return Distance in kilometers, or empty if OSRM found no route
     * @throws RoutingServiceException if the call fails, times out or the response is unreadable
     */
    @Override
    public Optional<Double> route(Coordinates from, Coordinates to) {
        String path = buildPath(from, to);
        logger.debug("OSRM request: {}", path);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path(path)
                    .queryParam("overview", "false")
                    .queryParam("alternatives", "false")
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.BAD_REQUEST.value() && isNoRoute(e.getResponseBodyAsString())) {
                logger.warn("OSRM found no route between {} and {}", from, to);
                return Optional.empty();
            }
            logger.error("OSRM returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new RoutingServiceException("OSRM returned " + e.getStatusCode(), e);
        } catch (WebClientException e) {
            logger.error("Failed to connect to OSRM", e);
            throw new RoutingServiceException("Failed to connect to OSRM", e);
        } catch (Exception e) {
            logger.error("Unexpected error querying OSRM", e);
            throw new RoutingServiceException("Unexpected error querying OSRM", e);
        }

        return parseResponse(responseBody);
    }

    /**
     * OSRM expects lon,lat order.
     */
    private String buildPath(Coordinates from, Coordinates to) {
        return String.format(Locale.ROOT, "/route/v1/%s/%.6f,%.6f;%.6f,%.6f",
            profile, from.getLng(), from.getLat(), to.getLng(), to.getLat());
    }

    private Optional<Double> parseResponse(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
        } catch (Exception e) {
            logger.error("Failed to parse OSRM response", e);
            throw new RoutingServiceException("Failed to parse OSRM response", e);
        }

        JsonNode routes = root.get("routes");
        if (routes == null || !routes.isArray() || routes.isEmpty()) {
            logger.warn("OSRM returned no routes");
            return Optional.empty();
        }

        JsonNode distance = routes.get(0).get("distance");
        if (distance == null || !distance.isNumber()) {
            logger.warn("OSRM route missing distance: {}", routes.get(0));
            return Optional.empty();
        }

        // distance is in meters
        double distanceKm = distance.asDouble() / 1000.0;
        logger.info("OSRM route distance: {} km", String.format(Locale.ROOT, "%.2f", distanceKm));
        return Optional.of(distanceKm);
    }

    private boolean isNoRoute(String body) {
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code != null && NO_ROUTE_CODES.contains(code.asText());
        } catch (Exception e) {
            logger.debug("Could not read OSRM error body: {}", e.getMessage());
            return false;
        }
    }
}
