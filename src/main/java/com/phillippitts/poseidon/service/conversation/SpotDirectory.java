package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.config.properties.SpotProperties;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.exception.UnknownSpotException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Static table of surf spots and their coordinates.
 *
 * <p>Names are matched case-insensitively, with spaces and underscores treated as dashes
 * ("Padang Padang", "padang_padang" and "padang-padang" are one spot). Entries from
 * {@code poseidon.spots.entries.*} extend or override the built-in table.
 */
@Component
public class SpotDirectory {

    static final Map<String, Coordinates> BUILT_IN = Map.of(
            "uluwatu", new Coordinates(-8.8149, 115.0884),
            "padang-padang", new Coordinates(-8.8111, 115.1030),
            "bingin", new Coordinates(-8.8055, 115.1132),
            "balangan", new Coordinates(-8.7906, 115.1233),
            "canggu", new Coordinates(-8.6478, 115.1385),
            "keramas", new Coordinates(-8.5936, 115.3396),
            "medewi", new Coordinates(-8.4181, 114.8067)
    );

    private final Map<String, Coordinates> spots;

    public SpotDirectory(SpotProperties properties) {
        Map<String, Coordinates> all = new TreeMap<>();
        BUILT_IN.forEach((name, coords) -> all.put(normalize(name), coords));
        properties.entries().forEach((name, coords) -> all.put(normalize(name), coords));
        this.spots = Collections.unmodifiableMap(all);
    }

    public Optional<Coordinates> find(String spotName) {
        if (spotName == null || spotName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(spots.get(normalize(spotName)));
    }

    /**
     * @throws UnknownSpotException if the spot is not in the table
     */
    public Coordinates lookup(String spotName) {
        return find(spotName).orElseThrow(() -> new UnknownSpotException(spotName));
    }

    /**
     * @return known spot names, sorted
     */
    public Iterable<String> names() {
        return spots.keySet();
    }

    static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
    }
}
