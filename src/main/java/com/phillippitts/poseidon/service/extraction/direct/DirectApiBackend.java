package com.phillippitts.poseidon.service.extraction.direct;

import com.phillippitts.poseidon.config.backend.DirectApiConfig;
import com.phillippitts.poseidon.config.properties.ConversationProperties;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.service.extraction.AbstractExtractionBackend;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import com.phillippitts.poseidon.service.extraction.ExtractionRequest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Queries a numeric marine forecast API by spot coordinates and date, bypassing the image.
 *
 * <p>The API does not expose wave power, so that field is always absent from this backend.
 * The requested day, the hourly slots and the tide times are all local to
 * {@code poseidon.conversation.zone}, the zone captions are read in, so the result lines up
 * with what the screenshot backends read.
 */
@Component
public class DirectApiBackend extends AbstractExtractionBackend {

    private final DirectApiConfig config;
    private final StormglassClient client;
    private final ZoneId zone;

    public DirectApiBackend(DirectApiConfig config, StormglassClient client,
                            ConversationProperties conversation, ApplicationEventPublisher publisher) {
        super(publisher);
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.zone = Objects.requireNonNull(conversation.zone(), "zone");
    }

    @Override
    protected ForecastSample doExtract(ExtractionRequest request) {
        Instant start = request.date().atStartOfDay(zone).toInstant();
        Instant end = request.date().plusDays(1).atStartOfDay(zone).toInstant();

        String weather = client.fetchWeather(request.coordinates(), start, end);
        StormglassJsonParser.HourlySeries hours = StormglassJsonParser.parseHours(
                weather, request.date(), zone, config.firstSlotHour(), config.slotCount());

        String tideJson = client.fetchTideExtremes(request.coordinates(), start, end);
        List<TideExtreme> tides = StormglassJsonParser.parseTideExtremes(tideJson, request.date(), zone);

        return ForecastSample.builder(Provenance.DIRECT_API)
                .waveHeights(hours.waveHeights())
                .wavePeriods(hours.wavePeriods())
                .windSpeeds(hours.windSpeeds())
                .tides(tides)
                .build();
    }

    @Override
    public boolean supports(ExtractionRequest request) {
        return request.hasCoordinates();
    }

    @Override
    public Provenance source() {
        return Provenance.DIRECT_API;
    }

    @Override
    public String name() {
        return BackendNames.DIRECT_API;
    }

    @Override
    public Duration timeout() {
        return config.timeout();
    }

    @Override
    public boolean isAvailable() {
        return config.enabled() && config.hasApiKey();
    }
}
