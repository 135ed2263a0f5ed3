package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.config.backend.OcrConfig;
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

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.Objects;

/**
 * Reads the forecast screenshot with OCR over an enhanced copy of the image.
 *
 * <p>Whether it runs alongside the vision backend or only as its stand-in is decided by
 * {@link com.phillippitts.poseidon.service.extraction.parallel.DefaultParallelExtractionService}
 * from {@code poseidon.reconciliation.ocr-mode}.
 */
@Component
public class OpticalTextBackend extends AbstractExtractionBackend {

    private static final Logger LOG = LogManager.getLogger(OpticalTextBackend.class);

    private final OcrConfig config;
    private final OcrEngine engine;
    private final ImageEnhancer enhancer;

    public OpticalTextBackend(OcrConfig config, OcrEngine engine, ApplicationEventPublisher publisher) {
        super(publisher);
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.enhancer = new ImageEnhancer(config.scaleFactor(), config.contrast());
    }

    @Override
    protected ForecastSample doExtract(ExtractionRequest request) {
        BufferedImage enhanced = enhancer.enhance(request.image());
        String text = engine.recognize(enhanced);
        LOG.debug("OCR text: {}", LogSanitizer.singleLine(text, 300));
        return OcrTextParser.parse(text);
    }

    @Override
    public boolean supports(ExtractionRequest request) {
        return request.hasImage();
    }

    @Override
    public Provenance source() {
        return Provenance.OPTICAL_TEXT;
    }

    @Override
    public String name() {
        return BackendNames.OCR;
    }

    @Override
    public Duration timeout() {
        return config.timeout();
    }

    @Override
    public boolean isAvailable() {
        return config.enabled();
    }
}
