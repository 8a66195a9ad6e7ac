package com.fieldops.scheduling.travel;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.List;

/**
 * Distance-matrix client for an HTTP travel-time service.
 *
 * POST {providerUrl}/travel-times
 *   {"legs":[{"originLat":..,"originLng":..,"destinationLat":..,"destinationLng":..}]}
 * 200
 *   {"durationsSeconds":[612, 1045, ...]}
 */
@Slf4j
public class HttpTravelTimeProvider implements TravelTimeProvider {

    private final RestClient restClient;

    public HttpTravelTimeProvider(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<Duration> travelTimes(List<TravelLeg> legs) {
        List<LegPayload> payload = legs.stream()
                .map(leg -> new LegPayload(
                        leg.getOrigin().getLatitude(), leg.getOrigin().getLongitude(),
                        leg.getDestination().getLatitude(), leg.getDestination().getLongitude()))
                .toList();

        MatrixResponse response;
        try {
            response = restClient.post()
                    .uri("/travel-times")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new MatrixRequest(payload))
                    .retrieve()
                    .body(MatrixResponse.class);
        } catch (RestClientException e) {
            throw new TravelTimeProviderException("Travel-time request failed: " + e.getMessage(), e);
        }

        if (response == null || response.getDurationsSeconds() == null) {
            throw new TravelTimeProviderException("Travel-time provider returned an empty body");
        }
        log.debug("Travel-time provider answered {} leg(s)", response.getDurationsSeconds().size());
        return response.getDurationsSeconds().stream()
                .map(s -> s == null ? null : Duration.ofSeconds(s))
                .toList();
    }

    @Override
    public String name() {
        return "http-distance-matrix";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class LegPayload {
        private double originLat;
        private double originLng;
        private double destinationLat;
        private double destinationLng;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class MatrixRequest {
        private List<LegPayload> legs;
    }

    @Data
    @NoArgsConstructor
    static class MatrixResponse {
        private List<Long> durationsSeconds;
    }
}
