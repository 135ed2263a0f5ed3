package com.phillippitts.poseidon.service.extraction.vision;

import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.domain.TideExtreme;
import com.phillippitts.poseidon.domain.TideKind;
import com.phillippitts.poseidon.exception.ExtractionExceptionBuilder;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a vision model reply into a {@link ForecastSample}.
 *
 * <p>Models wrap the payload in prose or Markdown code fences, so the parser scans for the
 * first brace-balanced substring that is a well-formed JSON object. Entries that are not
 * numbers become {@code NaN}, which disqualifies the whole field during sanitizing.
 */
final class VisionReplyParser {

    private static final Pattern LEADING_NUMBER = Pattern.compile("-?\\d+(?:[.,]\\d+)?");

    private VisionReplyParser() {}

    /**
     * @param reply raw reply text
     * @return parsed sample tagged {@link Provenance#VISION_MODEL}
     * @throws com.phillippitts.poseidon.exception.ExtractionException with
     *         {@link FailureKind#MALFORMED_OUTPUT} if no JSON object is present
     */
    static ForecastSample parse(String reply) {
        JSONObject obj = firstJsonObject(reply);
        if (obj == null) {
            throw ExtractionExceptionBuilder.create("Model reply contained no JSON object")
                    .backend(BackendNames.VISION)
                    .kind(FailureKind.MALFORMED_OUTPUT)
                    .metadata("replyLength", reply == null ? 0 : reply.length())
                    .build();
        }
        return ForecastSample.builder(Provenance.VISION_MODEL)
                .waveHeights(numbers(obj.optJSONArray("wave_height")))
                .wavePeriods(numbers(obj.optJSONArray("wave_period")))
                .wavePowers(numbers(obj.optJSONArray("wave_power")))
                .windSpeeds(numbers(obj.optJSONArray("wind_speed")))
                .tides(tides(obj.optJSONArray("tides")))
                .build();
    }

    /**
     * Returns the first well-formed JSON object embedded in the text, or null.
     */
    static JSONObject firstJsonObject(String text) {
        if (text == null) {
            return null;
        }
        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            int end = matchingBrace(text, start);
            if (end < 0) {
                continue;
            }
            try {
                return new JSONObject(text.substring(start, end + 1));
            } catch (JSONException ignored) {
                // not an object, try the next opening brace
            }
        }
        return null;
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<Double> numbers(JSONArray arr) {
        List<Double> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            Object v = arr.opt(i);
            if (v instanceof Number n) {
                out.add(n.doubleValue());
            } else {
                out.add(parseLeadingNumber(v == null ? "" : v.toString()));
            }
        }
        return out;
    }

    private static double parseLeadingNumber(String s) {
        Matcher m = LEADING_NUMBER.matcher(s);
        if (!m.find()) {
            return Double.NaN;
        }
        return Double.parseDouble(m.group().replace(',', '.'));
    }

    private static List<TideExtreme> tides(JSONArray arr) {
        List<TideExtreme> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            JSONObject t = arr.optJSONObject(i);
            if (t == null) {
                continue;
            }
            TideKind kind = tideKind(t.optString("type", ""));
            LocalTime time = parseTime(t.optString("time", ""));
            double height = t.opt("height") instanceof Number n
                    ? n.doubleValue()
                    : parseLeadingNumber(t.optString("height", ""));
            if (kind != null && time != null && !Double.isNaN(height)) {
                out.add(new TideExtreme(time, height, kind));
            }
        }
        return out;
    }

    private static TideKind tideKind(String type) {
        String t = type.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("high")) {
            return TideKind.HIGH;
        }
        if (t.startsWith("low")) {
            return TideKind.LOW;
        }
        return null;
    }

    private static LocalTime parseTime(String s) {
        String t = s.trim();
        if (t.length() == 4 && t.charAt(1) == ':') {
            t = "0" + t;
        }
        try {
            return LocalTime.parse(t);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
