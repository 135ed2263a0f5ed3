package com.phillippitts.poseidon.config.properties;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;
import java.util.List;

/**
 * Inbound conversation settings.
 *
 * @param triggerPhrases texts (case-insensitive, trimmed) that activate a session
 * @param zone           time zone used to resolve "today" when a caption carries no date
 */
@Validated
@ConfigurationProperties(prefix = "poseidon.conversation")
public record ConversationProperties(
        @NotEmpty
        @DefaultValue({"/surf", "surf", "poseidon"})
        List<String> triggerPhrases,

        @DefaultValue("UTC")
        ZoneId zone
) {
    public ConversationProperties {
        triggerPhrases = triggerPhrases == null ? List.of() : List.copyOf(triggerPhrases);
    }
}
