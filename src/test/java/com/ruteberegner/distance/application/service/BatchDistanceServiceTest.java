package com.ruteberegner.distance.application.service;

import com.ruteberegner.distance.api.dto.BatchDistanceEntryDto;
import com.ruteberegner.distance.api.dto.BatchDistanceResponseDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.application.mapper.DistanceMapper;
import com.ruteberegner.distance.domain.service.GeodesicDistanceCalculator;
import com.ruteberegner.distance.domain.service.LocationFormatResolver;
import com.ruteberegner.distance.infrastructure.cache.GeocodeCache;
import com.ruteberegner.distance.infrastructure.cache.RouteCache;
import com.ruteberegner.distance.module.test.support.FakeGeocodingGateway;
import com.ruteberegner.distance.module.test.support.FakeRoutingGateway;
import com.ruteberegner.distance.module.test.support.InMemoryFacilityDirectory;
import com.ruteberegner.distance.module.test.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.ruteberegner.distance.module.test.support.TestFixtures.Facilities;
import static com.ruteberegner.distance.module.test.support.TestFixtures.Locations;
import static org.assertj.core.api.Assertions.assertThat;

class BatchDistanceServiceTest {

    private FakeRoutingGateway router;
    private BatchDistanceService batchService;

    @BeforeEach
    void setUp() {
        FakeGeocodingGateway geocoder = new FakeGeocodingGateway()
                .answer(Facilities.DJURS_ADDRESS + ", Denmark", Locations.GRENAA_LAT, Locations.GRENAA_LNG);
        router = new FakeRoutingGateway();
        router.returns(63.2);

        DistanceResolutionService resolution = new DistanceResolutionService(
                new LocationFormatResolver(new InMemoryFacilityDirectory(TestFixtures.djursGenbrug())),
                geocoder,
                router,
                new GeodesicDistanceCalculator(),
                new GeocodeCache(10),
                new RouteCache(10),
                TestFixtures.geocodingRetry(1),
                TestFixtures.routingRetry(2),
                "Denmark",
                "denmark,danmark");
        batchService = new BatchDistanceService(resolution, new DistanceMapper());
    }

    @Test
    void failingPairsDoNotAbortTheBatch() {
        BatchDistanceResponseDto response = batchService.recompute(List.of(
                new DistanceQueryDto("56.1629,10.2039", Facilities.DJURS_ID),
                new DistanceQueryDto("56.1629,10.2039", "95.0,10.0"),
                new DistanceQueryDto("9999", Facilities.DJURS_ID),
                new DistanceQueryDto("", Facilities.DJURS_ID)));

        assertThat(response.getCount()).isEqualTo(4);
        assertThat(response.getResolved()).isEqualTo(1);
        assertThat(response.getFailed()).isEqualTo(3);

        List<BatchDistanceEntryDto> results = response.getResults();
        assertThat(results.get(0).getDistanceKm()).isEqualTo(63.2);
        assertThat(results.get(0).getSource()).isEqualTo("routed");
        assertThat(results.get(0).getError()).isNull();

        assertThat(results.get(1).getError()).isEqualTo("INVALID_INPUT");
        assertThat(results.get(1).getEndpoint()).isEqualTo("destination");

        assertThat(results.get(2).getError()).isEqualTo("GEOCODING_FAILED");
        assertThat(results.get(2).getEndpoint()).isEqualTo("origin");

        assertThat(results.get(3).getError()).isEqualTo("INVALID_INPUT");
        assertThat(results.get(3).getEndpoint()).isEqualTo("origin");
    }

    @Test
    void repeatedPairsShareTheRouteCache() {
        DistanceQueryDto pair = new DistanceQueryDto("56.1629,10.2039", Facilities.DJURS_ID);

        BatchDistanceResponseDto response = batchService.recompute(List.of(pair, pair));

        assertThat(response.getResults()).extracting(BatchDistanceEntryDto::getSource)
                .containsExactly("routed", "cache");
        assertThat(router.calls()).isEqualTo(1);
    }

    @Test
    void nullPairIsReportedAsInvalidInputWithoutFailingTheBatch() {
        BatchDistanceResponseDto response = batchService.recompute(Arrays.asList(
                null,
                new DistanceQueryDto("56.1629,10.2039", Facilities.DJURS_ID)));

        assertThat(response.getCount()).isEqualTo(2);
        assertThat(response.getResolved()).isEqualTo(1);
        assertThat(response.getFailed()).isEqualTo(1);

        BatchDistanceEntryDto nullRow = response.getResults().get(0);
        assertThat(nullRow.getError()).isEqualTo("INVALID_INPUT");
        assertThat(nullRow.getOrigin()).isNull();
        assertThat(nullRow.getDestination()).isNull();
        assertThat(response.getResults().get(1).getDistanceKm()).isEqualTo(63.2);
    }
}
