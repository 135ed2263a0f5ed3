package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.config.properties.SpotProperties;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.exception.UnknownSpotException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpotDirectoryTest {

    private final SpotDirectory directory = new SpotDirectory(new SpotProperties(Map.of()));

    @Test
    void matchesCaseInsensitivelyWithSeparatorsNormalized() {
        Coordinates expected = SpotDirectory.BUILT_IN.get("padang-padang");

        assertThat(directory.find("Padang Padang")).contains(expected);
        assertThat(directory.find("PADANG_PADANG")).contains(expected);
        assertThat(directory.find("padang-padang")).contains(expected);
    }

    @Test
    void unknownSpotThrows() {
        assertThatThrownBy(() -> directory.lookup("nowhere"))
                .isInstanceOf(UnknownSpotException.class)
                .satisfies(e -> assertThat(((UnknownSpotException) e).getSpotName()).isEqualTo("nowhere"));
        assertThat(directory.find("")).isEmpty();
        assertThat(directory.find(null)).isEmpty();
    }

    @Test
    void configuredEntriesExtendAndOverride() {
        Coordinates kuta = new Coordinates(-8.718, 115.168);
        Coordinates movedUluwatu = new Coordinates(-8.8, 115.0);
        SpotDirectory custom = new SpotDirectory(new SpotProperties(Map.of("Kuta", kuta, "uluwatu", movedUluwatu)));

        assertThat(custom.lookup("kuta")).isEqualTo(kuta);
        assertThat(custom.lookup("Uluwatu")).isEqualTo(movedUluwatu);
        assertThat(custom.names()).contains("kuta", "bingin");
    }

    @Test
    void namesAreSorted() {
        assertThat(directory.names()).containsExactly(
                "balangan", "bingin", "canggu", "keramas", "medewi", "padang-padang", "uluwatu");
    }
}
