package com.phillippitts.poseidon.config.backend;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the optical text (OCR) backend.
 * Binds to properties prefixed with "poseidon.backend.ocr".
 *
 * @param enabled       whether the backend takes part in reconciliation at all
 * @param dataPath      tessdata directory
 * @param language      Tesseract language code
 * @param timeout       per-call timeout
 * @param scaleFactor   upscaling applied before recognition
 * @param contrast      contrast multiplier applied before recognition
 */
@ConfigurationProperties(prefix = "poseidon.backend.ocr")
@Validated
public record OcrConfig(
        @DefaultValue("true")
        boolean enabled,

        @NotBlank(message = "Tessdata path must not be blank")
        @DefaultValue("/usr/share/tesseract-ocr/5/tessdata")
        String dataPath,

        @NotBlank(message = "OCR language must not be blank")
        @DefaultValue("eng")
        String language,

        @DefaultValue("20s")
        Duration timeout,

        @Positive(message = "Scale factor must be positive")
        @DefaultValue("2.0")
        double scaleFactor,

        @Positive(message = "Contrast must be positive")
        @DefaultValue("1.6")
        double contrast
) {
}
