package com.phillippitts.poseidon.service.extraction.ocr;

import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.domain.TideKind;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers forecast rows from OCR text with fixed row-label patterns.
 *
 * <p>A row is the first line whose label matches; every number after the label is one hourly
 * slot. Labels are checked from most to least specific because "wave" also appears in
 * "wave period" and "wave power".
 */
final class OcrTextParser {

    private static final Pattern PERIOD_ROW = Pattern.compile("(?i)^\\s*(?:wave\\s*|swell\\s*)?period\\b(.*)$");
    private static final Pattern POWER_ROW = Pattern.compile("(?i)^\\s*(?:wave\\s*)?(?:power|energy)\\b(.*)$");
    // Direction and gust rows carry numbers too; they must not take the speed or height slot
    private static final String NOT_DIRECTION = "(?!\\s*(?:direction|dir\\b|gusts?\\b))";
    private static final Pattern WIND_ROW =
            Pattern.compile("(?i)^\\s*wind" + NOT_DIRECTION + "(?:\\s*speed)?\\b(.*)$");
    private static final Pattern HEIGHT_ROW =
            Pattern.compile("(?i)^\\s*(?:waves?|swell)" + NOT_DIRECTION + "(?:\\s*height)?\\b(.*)$");

    private static final Pattern UNIT = Pattern.compile("^\\s*(?:\\((?:m|s|kj|m/s|km/h|kts)\\)|m/s|kj)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?");
    private static final Pattern TIDE = Pattern.compile(
            "(?i)\\b(high|low)\\w*(?:\\s+tide)?\\s*[:\\-]?\\s*(\\d{1,2})[:.](\\d{2})\\s*[-/,]?\\s*(\\d+(?:[.,]\\d+)?)\\s*m\\b");

    private OcrTextParser() {}

    static ForecastSample parse(String text) {
        ForecastSample.Builder builder = ForecastSample.builder(Provenance.OPTICAL_TEXT);
        if (text == null || text.isBlank()) {
            return builder.build();
        }
        List<Double> heights = List.of();
        List<Double> periods = List.of();
        List<Double> powers = List.of();
        List<Double> winds = List.of();
        for (String line : text.split("\\R")) {
            Matcher m;
            if ((m = PERIOD_ROW.matcher(line)).matches()) {
                periods = periods.isEmpty() ? numbers(m.group(1)) : periods;
            } else if ((m = POWER_ROW.matcher(line)).matches()) {
                powers = powers.isEmpty() ? numbers(m.group(1)) : powers;
            } else if ((m = WIND_ROW.matcher(line)).matches()) {
                winds = winds.isEmpty() ? numbers(m.group(1)) : winds;
            } else if ((m = HEIGHT_ROW.matcher(line)).matches()) {
                heights = heights.isEmpty() ? numbers(m.group(1)) : heights;
            }
        }
        return builder.waveHeights(heights)
                .wavePeriods(periods)
                .wavePowers(powers)
                .windSpeeds(winds)
                .tides(tides(text))
                .build();
    }

    static List<Double> numbers(String rowTail) {
        String rest = UNIT.matcher(rowTail).replaceFirst("");
        List<Double> out = new ArrayList<>();
        Matcher m = NUMBER.matcher(rest);
        while (m.find()) {
            out.add(Double.parseDouble(m.group().replace(',', '.')));
        }
        return out;
    }

    static List<TideExtreme> tides(String text) {
        List<TideExtreme> out = new ArrayList<>();
        Matcher m = TIDE.matcher(text);
        while (m.find()) {
            int hour = Integer.parseInt(m.group(2));
            int minute = Integer.parseInt(m.group(3));
            if (hour > 23 || minute > 59) {
                continue;
            }
            TideKind kind = m.group(1).toLowerCase(Locale.ROOT).startsWith("high") ? TideKind.HIGH : TideKind.LOW;
            double height = Double.parseDouble(m.group(4).replace(',', '.'));
            out.add(new TideExtreme(LocalTime.of(hour, minute), height, kind));
        }
        return out;
    }
}
