package com.phillippitts.poseidon.service.extraction.direct;

import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.domain.TideKind;
import com.phillippitts.poseidon.exception.ExtractionException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StormglassJsonParserTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 1);
    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final ZoneId BALI = ZoneId.of("Asia/Makassar");

    static final String WEATHER = """
            {"hours": [
              {"time": "2024-05-01T05:00:00+00:00",
               "waveHeight": {"sg": 0.9}, "wavePeriod": {"sg": 11.0}, "windSpeed": {"sg": 1.0}},
              {"time": "2024-05-01T06:00:00+00:00",
               "waveHeight": {"noaa": 1.3, "sg": 1.2}, "wavePeriod": {"sg": 12.1}, "windSpeed": {"sg": 2.4}},
              {"time": "2024-05-01T07:00:00+00:00",
               "waveHeight": {"noaa": 1.4}, "wavePeriod": {"sg": 12.3}, "windSpeed": {"sg": 2.8}},
              {"time": "2024-05-01T08:00:00+00:00",
               "waveHeight": {"sg": 1.5}, "wavePeriod": {"sg": 12.5}, "windSpeed": {"sg": 3.1}},
              {"time": "2024-05-02T06:00:00+00:00",
               "waveHeight": {"sg": 2.0}, "wavePeriod": {"sg": 14.0}, "windSpeed": {"sg": 5.0}}
            ]}""";

    static final String TIDES = """
            {"data": [
              {"height": 0.35, "time": "2024-05-01T04:12:00+00:00", "type": "low"},
              {"height": 2.18, "time": "2024-05-01T10:31:00+00:00", "type": "high"},
              {"height": 0.41, "time": "2024-05-02T04:50:00+00:00", "type": "low"}
            ]}""";

    @Test
    void takesHoursFromFirstSlotPreferringAggregatedSource() {
        StormglassJsonParser.HourlySeries s = StormglassJsonParser.parseHours(WEATHER, DATE, UTC, 6, 10);

        assertThat(s.waveHeights()).containsExactly(1.2, 1.4, 1.5);
        assertThat(s.wavePeriods()).containsExactly(12.1, 12.3, 12.5);
        assertThat(s.windSpeeds()).containsExactly(2.4, 2.8, 3.1);
    }

    @Test
    void stopsAtSlotCount() {
        StormglassJsonParser.HourlySeries s = StormglassJsonParser.parseHours(WEATHER, DATE, UTC, 6, 2);

        assertThat(s.waveHeights()).containsExactly(1.2, 1.4);
    }

    @Test
    void keepsOnlyTidesOfTheDay() {
        List<TideExtreme> tides = StormglassJsonParser.parseTideExtremes(TIDES, DATE, UTC);

        assertThat(tides).containsExactly(
                new TideExtreme(LocalTime.of(4, 12), 0.35, TideKind.LOW),
                new TideExtreme(LocalTime.of(10, 31), 2.18, TideKind.HIGH));
    }

    @Test
    void missingHoursArrayIsMalformed() {
        assertThatThrownBy(() -> StormglassJsonParser.parseHours("{\"errors\": {\"key\": \"invalid\"}}", DATE, UTC, 6, 10))
                .isInstanceOf(ExtractionException.class)
                .satisfies(e -> assertThat(((ExtractionException) e).getKind())
                        .isEqualTo(FailureKind.MALFORMED_OUTPUT));
        assertThatThrownBy(() -> StormglassJsonParser.parseHours("<html>", DATE, UTC, 6, 10))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    void missingTideDataGivesNoTides() {
        assertThat(StormglassJsonParser.parseTideExtremes("{}", DATE, UTC)).isEmpty();
    }

    @Test
    void tidesFollowTheLocalDayAndClock() {
        String json = """
                {"data": [
                  {"height": 0.52, "time": "2024-04-30T15:40:00+00:00", "type": "high"},
                  {"height": 0.30, "time": "2024-04-30T23:10:00+00:00", "type": "low"},
                  {"height": 2.10, "time": "2024-05-01T05:25:00+00:00", "type": "high"},
                  {"height": 0.44, "time": "2024-05-01T16:05:00+00:00", "type": "low"}
                ]}""";

        List<TideExtreme> tides = StormglassJsonParser.parseTideExtremes(json, DATE, BALI);

        assertThat(tides).containsExactly(
                new TideExtreme(LocalTime.of(7, 10), 0.30, TideKind.LOW),
                new TideExtreme(LocalTime.of(13, 25), 2.10, TideKind.HIGH));
    }

    @Test
    void firstSlotHourIsLocal() {
        String json = """
                {"hours": [
                  {"time": "2024-04-30T21:00:00+00:00", "waveHeight": {"sg": 0.8}},
                  {"time": "2024-04-30T22:00:00+00:00", "waveHeight": {"sg": 1.1}},
                  {"time": "2024-05-01T15:00:00+00:00", "waveHeight": {"sg": 1.6}},
                  {"time": "2024-05-01T16:00:00+00:00", "waveHeight": {"sg": 2.4}}
                ]}""";

        StormglassJsonParser.HourlySeries s = StormglassJsonParser.parseHours(json, DATE, BALI, 6, 10);

        assertThat(s.waveHeights()).containsExactly(1.1, 1.6);
    }
}
