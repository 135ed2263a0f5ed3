package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.domain.TideKind;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OcrTextParserTest {

    private static final String TABLE = """
            Uluwatu  Wed 1 May
            Time 6am 7am 8am 9am 10am
            Wave height (m) 1.2 1.3 1.3 1.4 1.5
            Wave period (s) 12 12 13 13 14
            Wave power (kJ) 320 340 360 380 410
            Wind (m/s) 2,5 3 3.5 4 5
            High tide 12:55 2.1m
            Low tide 06:40 0.4m
            """;

    @Test
    void readsEveryRowByLabel() {
        ForecastSample s = OcrTextParser.parse(TABLE);

        assertThat(s.provenance()).isEqualTo(Provenance.OPTICAL_TEXT);
        assertThat(s.waveHeights()).containsExactly(1.2, 1.3, 1.3, 1.4, 1.5);
        assertThat(s.wavePeriods()).containsExactly(12.0, 12.0, 13.0, 13.0, 14.0);
        assertThat(s.wavePowers()).containsExactly(320.0, 340.0, 360.0, 380.0, 410.0);
        assertThat(s.windSpeeds()).containsExactly(2.5, 3.0, 3.5, 4.0, 5.0);
    }

    @Test
    void readsTideExtremes() {
        List<TideExtreme> tides = OcrTextParser.parse(TABLE).tideExtremes();

        assertThat(tides).containsExactly(
                new TideExtreme(LocalTime.of(12, 55), 2.1, TideKind.HIGH),
                new TideExtreme(LocalTime.of(6, 40), 0.4, TideKind.LOW));
    }

    @Test
    void firstMatchingRowWins() {
        ForecastSample s = OcrTextParser.parse("Swell 1.0 1.1\nWaves 9 9\n");

        assertThat(s.waveHeights()).containsExactly(1.0, 1.1);
    }

    @Test
    void directionAndGustRowsAreNotSpeedsOrHeights() {
        ForecastSample s = OcrTextParser.parse("""
                Wave direction 200 210
                Wind direction 180 270
                Wind gust 8.0 9.5
                Wind dir 90 95
                Wave height 1.2 1.3
                Wind speed 2.1 3.4
                """);

        assertThat(s.windSpeeds()).containsExactly(2.1, 3.4);
        assertThat(s.waveHeights()).containsExactly(1.2, 1.3);
    }

    @Test
    void unitPrefixIsNotASlot() {
        assertThat(OcrTextParser.numbers(" m/s 4 5")).containsExactly(4.0, 5.0);
        assertThat(OcrTextParser.numbers(" (kJ) 300")).containsExactly(300.0);
    }

    @Test
    void invalidTideTimesAreSkipped() {
        assertThat(OcrTextParser.tides("high 27:10 2.0m low 05:15 0.2m"))
                .extracting(TideExtreme::kind)
                .containsExactly(TideKind.LOW);
    }

    @Test
    void blankTextGivesEmptySample() {
        assertThat(OcrTextParser.parse("  ").isEmpty()).isTrue();
        assertThat(OcrTextParser.parse(null).isEmpty()).isTrue();
    }
}
