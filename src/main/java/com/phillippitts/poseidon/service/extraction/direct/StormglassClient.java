package com.phillippitts.poseidon.service.extraction.direct;

import com.phillippitts.poseidon.config.backend.DirectApiConfig;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.exception.ExtractionExceptionBuilder;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import com.phillippitts.poseidon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Instant;
import java.util.Objects;

/**
 * Thin HTTP client for the Stormglass v2 point forecast and tide extremes endpoints.
 * Returns raw JSON; parsing lives in {@link StormglassJsonParser}.
 */
public class StormglassClient {

    private static final Logger LOG = LogManager.getLogger(StormglassClient.class);

    static final String WEATHER_PARAMS = "waveHeight,wavePeriod,windSpeed";

    private final RestClient restClient;
    private final DirectApiConfig config;

    public StormglassClient(RestClient restClient, DirectApiConfig config) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Fetches hourly wave and wind readings for the window.
     */
    public String fetchWeather(Coordinates spot, Instant start, Instant end) {
        return get("/weather/point", spot, start, end, "params", WEATHER_PARAMS);
    }

    /**
     * Fetches tide extremes for the window. Heights are relative to mean lower low water so
     * they stay non-negative.
     */
    public String fetchTideExtremes(Coordinates spot, Instant start, Instant end) {
        return get("/tide/extremes/point", spot, start, end, "datum", "MLLW");
    }

    private String get(String path, Coordinates spot, Instant start, Instant end,
                       String extraName, String extraValue) {
        LOG.debug("GET {} lat={} lng={}", path, spot.latitude(), spot.longitude());
        try {
            return restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path(path)
                            .queryParam("lat", spot.latitude())
                            .queryParam("lng", spot.longitude())
                            .queryParam("start", start.getEpochSecond())
                            .queryParam("end", end.getEpochSecond())
                            .queryParam(extraName, extraValue)
                            .build())
                    .header("Authorization", config.apiKey())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw ExtractionExceptionBuilder.create("Forecast API request failed")
                    .backend(BackendNames.DIRECT_API)
                    .kind(FailureKind.BACKEND_UNAVAILABLE)
                    .httpStatus(e.getStatusCode().value())
                    .metadata("path", path)
                    .metadata("body", LogSanitizer.truncate(e.getResponseBodyAsString(), 200))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw ExtractionExceptionBuilder.create("Forecast API unreachable")
                    .backend(BackendNames.DIRECT_API)
                    .kind(FailureKind.BACKEND_UNAVAILABLE)
                    .metadata("path", path)
                    .cause(e)
                    .build();
        }
    }
}
