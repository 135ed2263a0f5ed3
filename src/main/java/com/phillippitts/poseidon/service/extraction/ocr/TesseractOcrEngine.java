package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.config.backend.OcrConfig;
import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.exception.ExtractionExceptionBuilder;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * {@link OcrEngine} backed by Tesseract through tess4j.
 *
 * <p>{@link Tesseract} instances are not thread-safe, so one is created per call. The native
 * library is only loaded on first use; a missing library surfaces as
 * {@link FailureKind#BACKEND_UNAVAILABLE} instead of failing application startup.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger LOG = LogManager.getLogger(TesseractOcrEngine.class);

    // Page segmentation: assume a single uniform block of text (forecast tables)
    private static final int PSM_SINGLE_BLOCK = 6;
    // LSTM only
    private static final int OEM_LSTM_ONLY = 1;

    private final OcrConfig config;

    public TesseractOcrEngine(OcrConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String recognize(BufferedImage image) {
        try {
            Tesseract tesseract = new Tesseract();
            tesseract.setDatapath(config.dataPath());
            tesseract.setLanguage(config.language());
            tesseract.setPageSegMode(PSM_SINGLE_BLOCK);
            tesseract.setOcrEngineMode(OEM_LSTM_ONLY);
            String text = tesseract.doOCR(image);
            LOG.debug("Tesseract recognized {} characters", text == null ? 0 : text.length());
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw ExtractionExceptionBuilder.create("Tesseract recognition failed")
                    .backend(BackendNames.OCR)
                    .kind(FailureKind.BACKEND_UNAVAILABLE)
                    .cause(e)
                    .build();
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            throw ExtractionExceptionBuilder.create("Tesseract native library not available")
                    .backend(BackendNames.OCR)
                    .kind(FailureKind.BACKEND_UNAVAILABLE)
                    .metadata("dataPath", config.dataPath())
                    .cause(e)
                    .build();
        }
    }
}
