package com.phillippitts.poseidon.config.properties;

import com.phillippitts.poseidon.domain.Coordinates;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Additional surf spots on top of the built-in directory.
 *
 * <pre>
 * poseidon.spots.entries.uluwatu.latitude=-8.8150
 * poseidon.spots.entries.uluwatu.longitude=115.0860
 * </pre>
 *
 * @param entries spot name to coordinates; names are matched case-insensitively
 */
@ConfigurationProperties(prefix = "poseidon.spots")
public record SpotProperties(Map<String, Coordinates> entries) {

    public SpotProperties {
        entries = entries == null ? Map.of() : Map.copyOf(entries);
    }
}
