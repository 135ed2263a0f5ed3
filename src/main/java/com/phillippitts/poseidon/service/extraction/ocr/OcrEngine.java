package com.phillippitts.poseidon.service.extraction.ocr;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a prepared image.
 * Implementations throw {@link com.phillippitts.poseidon.exception.ExtractionException} on failure.
 */
public interface OcrEngine {

    /**
     * @param image enhanced image
     * @return recognized text, line breaks preserved
     */
    String recognize(BufferedImage image);
}
