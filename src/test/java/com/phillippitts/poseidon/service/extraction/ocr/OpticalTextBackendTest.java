package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.config.backend.OcrConfig;
import com.phillippitts.poseidon.domain.CandidateResult;
import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.exception.ExtractionException;
import com.phillippitts.poseidon.service.extraction.ExtractionRequest;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OpticalTextBackendTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 1);

    @Test
    void recognizedTextBecomesCandidate() throws IOException {
        OcrEngine engine = mock(OcrEngine.class);
        when(engine.recognize(any(BufferedImage.class))).thenReturn("Wave height 1.1 1.2\nWind 3 4");
        OpticalTextBackend backend = new OpticalTextBackend(config(true), engine, null);

        CandidateResult result = backend.extract(new ExtractionRequest(ImageEnhancerTest.png(30, 10), null, DATE));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.sample().waveHeights()).containsExactly(1.1, 1.2);
        assertThat(result.sample().windSpeeds()).containsExactly(3.0, 4.0);
    }

    @Test
    void textWithoutRowsIsMalformed() throws IOException {
        OcrEngine engine = mock(OcrEngine.class);
        when(engine.recognize(any(BufferedImage.class))).thenReturn("lorem ipsum");
        OpticalTextBackend backend = new OpticalTextBackend(config(true), engine, null);

        CandidateResult result = backend.extract(new ExtractionRequest(ImageEnhancerTest.png(30, 10), null, DATE));

        assertThat(result.failure()).isEqualTo(FailureKind.MALFORMED_OUTPUT);
    }

    @Test
    void engineFailureKeepsItsKind() throws IOException {
        OcrEngine engine = mock(OcrEngine.class);
        when(engine.recognize(any(BufferedImage.class)))
                .thenThrow(new ExtractionException("no tessdata", "ocr", FailureKind.BACKEND_UNAVAILABLE));
        OpticalTextBackend backend = new OpticalTextBackend(config(true), engine, null);

        CandidateResult result = backend.extract(new ExtractionRequest(ImageEnhancerTest.png(30, 10), null, DATE));

        assertThat(result.failure()).isEqualTo(FailureKind.BACKEND_UNAVAILABLE);
    }

    @Test
    void disabledBackendIsUnavailable() {
        OpticalTextBackend backend = new OpticalTextBackend(config(false), mock(OcrEngine.class), null);

        assertThat(backend.isAvailable()).isFalse();
    }

    private static OcrConfig config(boolean enabled) {
        return new OcrConfig(enabled, "/tmp/tessdata", "eng", Duration.ofSeconds(5), 2.0, 1.5);
    }
}
