package com.phillippitts.poseidon.service.extraction.direct;

import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.domain.TideKind;
import com.phillippitts.poseidon.exception.ExtractionExceptionBuilder;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Parses Stormglass v2 JSON replies.
 *
 * <p>Each hourly reading is an object keyed by data source ({@code sg}, {@code noaa}, ...).
 * The aggregated {@code sg} value is preferred, otherwise the first numeric source is taken.
 * The API answers in UTC; every timestamp is moved to the spot's zone before it is compared
 * with the requested day or turned into a clock time.
 */
final class StormglassJsonParser {

    static final String PREFERRED_SOURCE = "sg";

    /**
     * Hourly readings of one day.
     */
    record HourlySeries(List<Double> waveHeights, List<Double> wavePeriods, List<Double> windSpeeds) {}

    private StormglassJsonParser() {}

    /**
     * Extracts up to {@code slotCount} hourly readings on the local {@code date}, starting at the
     * local {@code firstSlotHour}.
     *
     * @throws com.phillippitts.poseidon.exception.ExtractionException with
     *         {@link FailureKind#MALFORMED_OUTPUT} if the reply has no {@code hours} array
     */
    static HourlySeries parseHours(String json, LocalDate date, ZoneId zone, int firstSlotHour, int slotCount) {
        JSONArray hours = root(json).optJSONArray("hours");
        if (hours == null) {
            throw malformed("Forecast API reply has no hours array", null);
        }
        List<Double> heights = new ArrayList<>();
        List<Double> periods = new ArrayList<>();
        List<Double> winds = new ArrayList<>();
        int taken = 0;
        for (int i = 0; i < hours.length() && taken < slotCount; i++) {
            JSONObject hour = hours.optJSONObject(i);
            if (hour == null) {
                continue;
            }
            ZonedDateTime time = parseTime(hour.optString("time", ""), zone);
            if (time == null || !time.toLocalDate().equals(date) || time.getHour() < firstSlotHour) {
                continue;
            }
            addIfPresent(heights, hour.optJSONObject("waveHeight"));
            addIfPresent(periods, hour.optJSONObject("wavePeriod"));
            addIfPresent(winds, hour.optJSONObject("windSpeed"));
            taken++;
        }
        return new HourlySeries(heights, periods, winds);
    }

    /**
     * Extracts tide extremes falling on the local {@code date}, with local clock times.
     */
    static List<TideExtreme> parseTideExtremes(String json, LocalDate date, ZoneId zone) {
        JSONArray data = root(json).optJSONArray("data");
        List<TideExtreme> out = new ArrayList<>();
        if (data == null) {
            return out;
        }
        for (int i = 0; i < data.length(); i++) {
            JSONObject entry = data.optJSONObject(i);
            if (entry == null) {
                continue;
            }
            ZonedDateTime time = parseTime(entry.optString("time", ""), zone);
            String type = entry.optString("type", "").toLowerCase(Locale.ROOT);
            double height = entry.optDouble("height", Double.NaN);
            if (time == null || !time.toLocalDate().equals(date) || Double.isNaN(height)) {
                continue;
            }
            TideKind kind;
            if ("high".equals(type)) {
                kind = TideKind.HIGH;
            } else if ("low".equals(type)) {
                kind = TideKind.LOW;
            } else {
                continue;
            }
            out.add(new TideExtreme(LocalTime.of(time.getHour(), time.getMinute()), height, kind));
        }
        return out;
    }

    private static JSONObject root(String json) {
        if (json == null || json.isBlank()) {
            throw malformed("Forecast API returned an empty body", null);
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw malformed("Forecast API reply is not a JSON object", e);
        }
    }

    private static void addIfPresent(List<Double> target, JSONObject bySource) {
        if (bySource == null) {
            return;
        }
        if (bySource.has(PREFERRED_SOURCE)) {
            double v = bySource.optDouble(PREFERRED_SOURCE, Double.NaN);
            if (!Double.isNaN(v)) {
                target.add(v);
                return;
            }
        }
        Iterator<String> keys = bySource.keys();
        while (keys.hasNext()) {
            double v = bySource.optDouble(keys.next(), Double.NaN);
            if (!Double.isNaN(v)) {
                target.add(v);
                return;
            }
        }
    }

    private static ZonedDateTime parseTime(String s, ZoneId zone) {
        try {
            return OffsetDateTime.parse(s).atZoneSameInstant(zone);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static RuntimeException malformed(String message, Throwable cause) {
        return ExtractionExceptionBuilder.create(message)
                .backend(BackendNames.DIRECT_API)
                .kind(FailureKind.MALFORMED_OUTPUT)
                .cause(cause)
                .build();
    }
}
