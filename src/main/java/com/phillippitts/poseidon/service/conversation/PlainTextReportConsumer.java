package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.domain.FieldKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.TideExtreme;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Minimal plain-text report: one line per available field with range and per-slot values.
 * Absent fields are left out. Provenance is internal and never shown.
 */
@Component
public class PlainTextReportConsumer implements ReportConsumer {

    @Override
    public String present(ForecastSample sample, String spotName, LocalDate date) {
        StringBuilder sb = new StringBuilder();
        sb.append("Surf report for ").append(spotName).append(", ").append(date).append('\n');
        appendSeries(sb, sample, FieldKind.WAVE_HEIGHT, "Waves", "m");
        appendSeries(sb, sample, FieldKind.WAVE_PERIOD, "Period", "s");
        appendSeries(sb, sample, FieldKind.WAVE_POWER, "Power", "kJ");
        appendSeries(sb, sample, FieldKind.WIND_SPEED, "Wind", "m/s");
        if (sample.has(FieldKind.TIDE_EXTREMES)) {
            sb.append("Tides: ");
            sb.append(sample.tideExtremes().stream()
                    .sorted((a, b) -> a.time().compareTo(b.time()))
                    .map(PlainTextReportConsumer::formatTide)
                    .collect(Collectors.joining(", ")));
            sb.append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static void appendSeries(StringBuilder sb, ForecastSample sample, FieldKind field,
                                     String label, String unit) {
        if (!sample.has(field)) {
            return;
        }
        List<Double> values = sample.series(field);
        sb.append(label).append(": ")
                .append(format(Collections.min(values))).append('-')
                .append(format(Collections.max(values))).append(' ').append(unit)
                .append(" [")
                .append(values.stream().map(PlainTextReportConsumer::format).collect(Collectors.joining(" ")))
                .append("]\n");
    }

    private static String formatTide(TideExtreme t) {
        return t.kind().name().toLowerCase(Locale.ROOT) + ' ' + t.time() + ' ' + format(t.height()) + 'm';
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
