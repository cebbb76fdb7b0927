package com.ruteberegner.distance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruteberegner.distance.api.dto.BatchDistanceRequestDto;
import com.ruteberegner.distance.api.dto.DistanceQueryDto;
import com.ruteberegner.distance.application.port.in.CacheMaintenanceUseCase;
import com.ruteberegner.distance.application.port.out.GeocodingGateway;
import com.ruteberegner.distance.application.port.out.RoutingGateway;
import com.ruteberegner.distance.application.port.out.RoutingGateway.RoutingServiceException;
import com.ruteberegner.distance.domain.model.Coordinates;
import com.ruteberegner.distance.domain.repository.FacilityDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Optional;

import static com.ruteberegner.distance.module.test.support.TestFixtures.Facilities;
import static com.ruteberegner.distance.module.test.support.TestFixtures.Locations;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DistanceIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CacheMaintenanceUseCase cacheMaintenanceUseCase;

    @Autowired
    private FacilityDirectory facilityDirectory;

    @Autowired
    private ApplicationContext applicationContext;

    @MockBean
    private GeocodingGateway geocodingGateway;

    @MockBean
    private RoutingGateway routingGateway;

    /**
     * Caches are application singletons; clear them so tests do not see each other's entries.
     */
    @BeforeEach
    void clearCaches() {
        cacheMaintenanceUseCase.clearAllCaches();

        when(geocodingGateway.geocode(anyString())).thenReturn(Optional.empty());
        when(geocodingGateway.geocode(Locations.COPENHAGEN_ADDRESS + ", Denmark"))
                .thenReturn(Optional.of(new Coordinates(Locations.COPENHAGEN_LAT, Locations.COPENHAGEN_LNG)));
        when(geocodingGateway.geocode(Facilities.DJURS_ADDRESS + ", Denmark"))
                .thenReturn(Optional.of(new Coordinates(Locations.GRENAA_LAT, Locations.GRENAA_LNG)));
    }

    @Test
    void seededFacilitiesAreAvailable() {
        assertThat(facilityDirectory.existsByFacilityId("1061")).isTrue();
        assertThat(facilityDirectory.existsByFacilityId("1072")).isTrue();
        assertThat(facilityDirectory.existsByFacilityId(Facilities.RANDERS_ID)).isTrue();
    }

    @Test
    void webClientBuilderIsTheAutoConfiguredPrototype() {
        String[] names = applicationContext.getBeanNamesForType(WebClient.Builder.class);

        assertThat(names).hasSize(1);
        assertThat(applicationContext.isPrototype(names[0])).isTrue();
    }

    @Test
    void testGetDistance_RoutingDown_ReturnsGeodesicEstimate() throws Exception {
        when(routingGateway.route(any(), any())).thenThrow(new RoutingServiceException("OSRM returned 503",
                WebClientResponseException.create(503, "Service Unavailable", HttpHeaders.EMPTY, new byte[0], null)));

        mockMvc.perform(get("/distances")
                        .param("origin", Locations.COPENHAGEN_ADDRESS)
                        .param("destination", Facilities.DJURS_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.origin").value(Locations.COPENHAGEN_ADDRESS))
                .andExpect(jsonPath("$.destination").value(Facilities.DJURS_ID))
                .andExpect(jsonPath("$.source").value("geodesic"))
                .andExpect(jsonPath("$.estimate").value(true))
                .andExpect(jsonPath("$.distanceKm", allOf(greaterThan(100.0), lessThan(170.0))));

        // test profile allows two routing attempts
        verify(routingGateway, times(2)).route(any(), any());
    }

    @Test
    void testGetDistance_SecondLookup_ServedFromCache() throws Exception {
        when(routingGateway.route(any(), any())).thenReturn(Optional.of(157.3));

        mockMvc.perform(get("/distances")
                        .param("origin", Locations.COPENHAGEN_ADDRESS)
                        .param("destination", Facilities.DJURS_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("routed"))
                .andExpect(jsonPath("$.distanceKm").value(157.3))
                .andExpect(jsonPath("$.estimate").value(false));

        mockMvc.perform(get("/distances")
                        .param("origin", Facilities.DJURS_ID)
                        .param("destination", Locations.COPENHAGEN_ADDRESS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("cache"))
                .andExpect(jsonPath("$.distanceKm").value(157.3));

        verify(routingGateway, times(1)).route(any(), any());
        verify(geocodingGateway, times(1)).geocode(Locations.COPENHAGEN_ADDRESS + ", Denmark");
    }

    @Test
    void testGetDistance_CachedGeodesic_StillMarkedAsEstimate() throws Exception {
        when(routingGateway.route(any(), any())).thenThrow(new RoutingServiceException("OSRM returned 503",
                WebClientResponseException.create(503, "Service Unavailable", HttpHeaders.EMPTY, new byte[0], null)));

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(get("/distances")
                            .param("origin", "56.1629,10.2039")
                            .param("destination", Facilities.DJURS_ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.estimate").value(true));
        }

        mockMvc.perform(get("/distances")
                        .param("origin", Facilities.DJURS_ID)
                        .param("destination", "56.1629,10.2039"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("cache"))
                .andExpect(jsonPath("$.estimate").value(true));

        verify(routingGateway, times(2)).route(any(), any());
    }

    @Test
    void testGetDistance_OutOfRangeCoordinates_Returns400() throws Exception {
        mockMvc.perform(get("/distances")
                        .param("origin", Facilities.DJURS_ID)
                        .param("destination", "95.0,10.0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.endpoint").value("destination"));

        verify(geocodingGateway, never()).geocode(anyString());
    }

    @Test
    void testGetDistance_MissingDestination_Returns400() throws Exception {
        mockMvc.perform(get("/distances").param("origin", Facilities.DJURS_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors.destination").exists());
    }

    @Test
    void testGetDistance_UnknownFacility_Returns422() throws Exception {
        mockMvc.perform(get("/distances")
                        .param("origin", "9999")
                        .param("destination", Facilities.DJURS_ID))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("GEOCODING_FAILED"))
                .andExpect(jsonPath("$.endpoint").value("origin"))
                .andExpect(jsonPath("$.reason").value("UNKNOWN_FACILITY"));
    }

    @Test
    void testGetDistance_NoGeocodingMatch_Returns422() throws Exception {
        mockMvc.perform(get("/distances")
                        .param("origin", Facilities.DJURS_ID)
                        .param("destination", "Ukendtvej 99, 9999 Intetsteds"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.endpoint").value("destination"))
                .andExpect(jsonPath("$.reason").value("NO_MATCH"));
    }

    @Test
    void testBatch_MixedPairs_ReportsPerEntry() throws Exception {
        when(routingGateway.route(any(), any())).thenReturn(Optional.of(63.2));
        BatchDistanceRequestDto request = new BatchDistanceRequestDto(List.of(
                new DistanceQueryDto("56.1629,10.2039", Facilities.DJURS_ID),
                new DistanceQueryDto("9999", Facilities.DJURS_ID)));

        mockMvc.perform(post("/distances/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.resolved").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.results[0].source").value("routed"))
                .andExpect(jsonPath("$.results[0].error").doesNotExist())
                .andExpect(jsonPath("$.results[1].error").value("GEOCODING_FAILED"))
                .andExpect(jsonPath("$.results[1].distanceKm").doesNotExist());
    }

    @Test
    void testBatch_NullPair_ReportedAsInvalidInput() throws Exception {
        when(routingGateway.route(any(), any())).thenReturn(Optional.of(63.2));

        mockMvc.perform(post("/distances/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pairs\":[null,{\"origin\":\"56.1629,10.2039\",\"destination\":\""
                                + Facilities.DJURS_ID + "\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.resolved").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.results[0].error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.results[1].source").value("routed"));
    }

    @Test
    void testBatch_EmptyPairs_Returns400() throws Exception {
        mockMvc.perform(post("/distances/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pairs\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void testClassify_KnownFacility() throws Exception {
        mockMvc.perform(get("/locations/classify").param("token", Facilities.RANDERS_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("identifier"))
                .andExpect(jsonPath("$.facilityName").value("Randers Slamhåndtering"))
                .andExpect(jsonPath("$.address").value(Facilities.RANDERS_ADDRESS));
    }

    @Test
    void testClassify_CoordinateLiteral() throws Exception {
        mockMvc.perform(get("/locations/classify").param("token", "56.4167,10.7833"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("coordinates"))
                .andExpect(jsonPath("$.lat").value(56.4167))
                .andExpect(jsonPath("$.lng").value(10.7833))
                .andExpect(jsonPath("$.facilityId").doesNotExist());
    }

    @Test
    void testClassify_Address() throws Exception {
        mockMvc.perform(get("/locations/classify").param("token", Locations.COPENHAGEN_ADDRESS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("address"))
                .andExpect(jsonPath("$.plausibleAddress").value(true));
    }

    @Test
    void testCacheEndpoints_WarmStatsAndClear() throws Exception {
        List<DistanceQueryDto> routes = List.of(new DistanceQueryDto(Locations.COPENHAGEN_ADDRESS, Facilities.DJURS_ID));

        mockMvc.perform(post("/cache/warm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(routes)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(1))
                .andExpect(jsonPath("$.geocoded").value(2))
                .andExpect(jsonPath("$.failed").value(0));

        mockMvc.perform(get("/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.geocode.size").value(2))
                .andExpect(jsonPath("$.geocode.capacity").value(50))
                .andExpect(jsonPath("$.route.size").value(0));

        mockMvc.perform(delete("/cache"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/cache/stats"))
                .andExpect(jsonPath("$.geocode.size").value(0))
                .andExpect(jsonPath("$.geocode.totalRequests").value(0));
    }
}
