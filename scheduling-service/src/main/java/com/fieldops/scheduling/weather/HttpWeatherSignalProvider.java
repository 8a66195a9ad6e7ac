package com.fieldops.scheduling.weather;

import com.fieldops.scheduling.domain.GeoPoint;
import org.springframework.web.client.RestClient;

import java.time.Instant;

/**
 * GET {providerUrl}/observations?lat=..&lng=..&at=..  ->  WeatherObservation JSON
 */
public class HttpWeatherSignalProvider implements WeatherSignalProvider {

    private final RestClient restClient;

    public HttpWeatherSignalProvider(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public WeatherObservation observe(GeoPoint location, Instant at) {
        return restClient.get()
                .uri(uri -> uri.path("/observations")
                        .queryParam("lat", location.getLatitude())
                        .queryParam("lng", location.getLongitude())
                        .queryParam("at", at.toString())
                        .build())
                .retrieve()
                .body(WeatherObservation.class);
    }
}
