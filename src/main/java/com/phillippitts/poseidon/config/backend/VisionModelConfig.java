package com.phillippitts.poseidon.config.backend;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the vision model backend.
 * Binds to properties prefixed with "poseidon.backend.vision".
 *
 * <p>Example application.properties:
 * <pre>
 * poseidon.backend.vision.base-url=https://api.deepseek.com/v1
 * poseidon.backend.vision.model=deepseek-vl2
 * poseidon.backend.vision.api-key=${VISION_API_KEY:}
 * poseidon.backend.vision.timeout=45s
 * </pre>
 *
 * @param enabled   whether the backend takes part in reconciliation at all
 * @param baseUrl   base URL of an OpenAI-compatible chat-completions API
 * @param model     vision-capable model name
 * @param apiKey    bearer token; blank makes the backend permanently unavailable
 * @param timeout   per-call timeout
 * @param maxTokens reply token cap
 */
@ConfigurationProperties(prefix = "poseidon.backend.vision")
@Validated
public record VisionModelConfig(
        @DefaultValue("true")
        boolean enabled,

        @NotBlank(message = "Vision model base URL must not be blank")
        @DefaultValue("https://api.deepseek.com/v1")
        String baseUrl,

        @NotBlank(message = "Vision model name must not be blank")
        @DefaultValue("deepseek-vl2")
        String model,

        String apiKey,

        @DefaultValue("45s")
        Duration timeout,

        @DefaultValue("800")
        int maxTokens
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
