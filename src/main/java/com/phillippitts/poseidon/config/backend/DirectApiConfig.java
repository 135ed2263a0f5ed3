package com.phillippitts.poseidon.config.backend;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the direct forecast API backend (Stormglass v2).
 * Binds to properties prefixed with "poseidon.backend.direct-api".
 *
 * @param enabled       whether the backend takes part in reconciliation at all
 * @param baseUrl       API base URL
 * @param apiKey        API key sent in the Authorization header; blank makes the backend unavailable
 * @param timeout       per-call timeout covering both the weather and the tide request
 * @param slotCount     number of hourly samples taken from the day
 * @param firstSlotHour hour of the first sample, local to {@code poseidon.conversation.zone}
 */
@ConfigurationProperties(prefix = "poseidon.backend.direct-api")
@Validated
public record DirectApiConfig(
        @DefaultValue("true")
        boolean enabled,

        @NotBlank(message = "Direct API base URL must not be blank")
        @DefaultValue("https://api.stormglass.io/v2")
        String baseUrl,

        String apiKey,

        @DefaultValue("30s")
        Duration timeout,

        @Positive
        @DefaultValue("10")
        int slotCount,

        @Min(0)
        @Max(23)
        @DefaultValue("6")
        int firstSlotHour
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
