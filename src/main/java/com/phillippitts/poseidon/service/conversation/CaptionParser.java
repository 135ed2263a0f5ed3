package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.config.properties.ConversationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Splits an image caption on whitespace: first token is the spot, second the date.
 *
 * <p>Dates are accepted as {@code yyyy-MM-dd} or {@code dd.MM.yyyy}. A missing or unparseable
 * date means today in the configured zone. Further tokens are ignored.
 */
@Component
public class CaptionParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd.MM.yyyy")
    );

    private final Clock clock;
    private final ConversationProperties properties;

    public CaptionParser(Clock clock, ConversationProperties properties) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public Caption parse(String caption) {
        String[] tokens = caption == null ? new String[0] : caption.strip().split("\\s+");
        String spot = tokens.length > 0 ? tokens[0] : "";
        LocalDate date = tokens.length > 1 ? parseDate(tokens[1]) : null;
        return new Caption(spot, date != null ? date : today());
    }

    LocalDate today() {
        return LocalDate.now(clock.withZone(properties.zone()));
    }

    private static LocalDate parseDate(String token) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(token, format);
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return null;
    }
}
