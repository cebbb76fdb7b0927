package com.ruteberegner.distance.infrastructure.retry;

import com.ruteberegner.distance.application.port.out.RoutingGateway.RoutingServiceException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.URI;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPredicatesTest {

    private final Predicate<Throwable> routing = RetryPredicates.transientFailure(RetryPredicates.TRANSIENT_HTTP_STATUSES);
    private final Predicate<Throwable> geocoding = RetryPredicates.timeoutOrStatus(Set.of(429, 503));

    private static WebClientResponseException status(int code) {
        return WebClientResponseException.create(code, "status " + code, HttpHeaders.EMPTY, new byte[0], null);
    }

    @Test
    void transientStatusesAreRetriedEvenWhenWrapped() {
        assertThat(routing.test(new RoutingServiceException("OSRM returned 503", status(503)))).isTrue();
        assertThat(routing.test(status(429))).isTrue();
        assertThat(routing.test(status(502))).isTrue();
        assertThat(routing.test(status(504))).isTrue();
    }

    @Test
    void clientErrorsAreNotRetried() {
        assertThat(routing.test(new RoutingServiceException("OSRM returned 400", status(400)))).isFalse();
        assertThat(routing.test(status(404))).isFalse();
        assertThat(routing.test(status(500))).isFalse();
    }

    @Test
    void timeoutsAreRetried() {
        RuntimeException wrapped = new RoutingServiceException("Unexpected error", new RuntimeException(new TimeoutException()));

        assertThat(routing.test(wrapped)).isTrue();
        assertThat(geocoding.test(wrapped)).isTrue();
    }

    @Test
    void connectionFailuresAreRetriedOnlyForRouting() {
        WebClientRequestException connection = new WebClientRequestException(
                new ConnectException("refused"), HttpMethod.GET, URI.create("http://localhost"), HttpHeaders.EMPTY);

        assertThat(routing.test(connection)).isTrue();
        assertThat(geocoding.test(connection)).isFalse();
    }

    @Test
    void geocodingRetriesOnlyRateLimitAndUnavailable() {
        assertThat(geocoding.test(status(429))).isTrue();
        assertThat(geocoding.test(status(503))).isTrue();
        assertThat(geocoding.test(status(502))).isFalse();
    }

    @Test
    void plainFailuresAreNotRetried() {
        assertThat(routing.test(new IllegalStateException("parse error"))).isFalse();
    }
}
