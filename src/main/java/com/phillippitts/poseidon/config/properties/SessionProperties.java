package com.phillippitts.poseidon.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Conversation session lifecycle settings.
 *
 * @param expiry how long a session waits for an acknowledgement after a report was delivered
 *               before it falls back to idle on its own
 */
@Validated
@ConfigurationProperties(prefix = "poseidon.session")
public record SessionProperties(@DefaultValue("10m") Duration expiry) {

    public SessionProperties {
        if (expiry == null || expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("poseidon.session.expiry must be positive");
        }
    }
}
