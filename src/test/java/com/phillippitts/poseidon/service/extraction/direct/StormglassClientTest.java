package com.phillippitts.poseidon.service.extraction.direct;

import com.phillippitts.poseidon.config.backend.DirectApiConfig;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.exception.ExtractionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class StormglassClientTest {

    private static final Coordinates SPOT = new Coordinates(-8.81, 115.09);
    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-05-02T00:00:00Z");

    private MockRestServiceServer server;
    private StormglassClient client;

    @BeforeEach
    void setUp() {
        DirectApiConfig config = new DirectApiConfig(true, "https://api.test/v2", "sg-key",
                Duration.ofSeconds(5), 10, 6);
        RestClient.Builder builder = RestClient.builder().baseUrl(config.baseUrl());
        server = MockRestServiceServer.bindTo(builder).build();
        client = new StormglassClient(builder.build(), config);
    }

    @Test
    void weatherRequestCarriesKeyWindowAndParams() {
        server.expect(requestTo(startsWith("https://api.test/v2/weather/point")))
                .andExpect(header("Authorization", "sg-key"))
                .andExpect(queryParam("start", String.valueOf(START.getEpochSecond())))
                .andExpect(queryParam("end", String.valueOf(END.getEpochSecond())))
                .andExpect(queryParam("params", "waveHeight,wavePeriod,windSpeed"))
                .andRespond(withSuccess("{\"hours\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchWeather(SPOT, START, END)).contains("hours");
        server.verify();
    }

    @Test
    void tideRequestUsesLowWaterDatum() {
        server.expect(requestTo(startsWith("https://api.test/v2/tide/extremes/point")))
                .andExpect(queryParam("datum", "MLLW"))
                .andRespond(withSuccess("{\"data\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchTideExtremes(SPOT, START, END)).contains("data");
        server.verify();
    }

    @Test
    void quotaErrorBecomesExtractionException() {
        server.expect(requestTo(startsWith("https://api.test/v2/weather/point")))
                .andRespond(withStatus(HttpStatus.PAYMENT_REQUIRED).body("{\"errors\":{\"key\":\"quota\"}}"));

        assertThatThrownBy(() -> client.fetchWeather(SPOT, START, END))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("httpStatus=402");
    }
}
