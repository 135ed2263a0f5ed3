package com.phillippitts.poseidon.service.extraction.vision;

import com.phillippitts.poseidon.config.backend.VisionModelConfig;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.service.extraction.AbstractExtractionBackend;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import com.phillippitts.poseidon.service.extraction.ExtractionRequest;
import com.phillippitts.poseidon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Reads the forecast screenshot with a vision-capable generative model.
 *
 * <p>The model is asked for a fixed-schema JSON object; see {@link VisionReplyParser}.
 * A blank API key makes the backend permanently unavailable.
 */
@Component
public class VisionModelBackend extends AbstractExtractionBackend {

    private static final Logger LOG = LogManager.getLogger(VisionModelBackend.class);

    static final String INSTRUCTION = """
            You are reading a surf forecast screenshot with hourly columns.
            Reply with ONLY one JSON object, no prose, using exactly these keys:
            {"wave_height": [m per column], "wave_period": [s per column],
             "wave_power": [kJ per column], "wind_speed": [m/s per column],
             "tides": [{"time": "HH:mm", "height": m, "type": "high" or "low"}]}
            Numbers only, left to right. Use [] for any row you cannot read.""";

    private final VisionModelConfig config;
    private final VisionModelClient client;

    public VisionModelBackend(VisionModelConfig config,
                              VisionModelClient client,
                              ApplicationEventPublisher publisher) {
        super(publisher);
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    protected ForecastSample doExtract(ExtractionRequest request) {
        String reply = client.describe(request.image(), INSTRUCTION);
        LOG.debug("Vision reply: {}", LogSanitizer.truncate(reply, 300));
        return VisionReplyParser.parse(reply);
    }

    @Override
    public boolean supports(ExtractionRequest request) {
        return request.hasImage();
    }

    @Override
    public Provenance source() {
        return Provenance.VISION_MODEL;
    }

    @Override
    public String name() {
        return BackendNames.VISION;
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
