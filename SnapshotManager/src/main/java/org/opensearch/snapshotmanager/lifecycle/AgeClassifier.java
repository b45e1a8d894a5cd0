package org.opensearch.snapshotmanager.lifecycle;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides the age of a data stream or snapshot from the date embedded at the end of its name,
 * e.g. {@code logs-app-2023.06.15}.  Stateless; the only notion of "now" comes from the clock passed in.
 */
@Slf4j
public class AgeClassifier {
    public static final String DATA_STREAM_KIND = "data stream";
    public static final String SNAPSHOT_KIND = "snapshot";

    // yyyy.MM.dd with an unsigned four-digit year
    private static final DateTimeFormatter NAME_DATE_FORMAT = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4)
        .appendLiteral('.')
        .appendValue(ChronoField.MONTH_OF_YEAR, 2)
        .appendLiteral('.')
        .appendValue(ChronoField.DAY_OF_MONTH, 2)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);

    private AgeClassifier() {}

    public static Optional<LocalDate> extractDate(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var dateText = name.substring(name.lastIndexOf('-') + 1);
        try {
            return Optional.of(LocalDate.parse(dateText, NAME_DATE_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * A name dated on the cutoff day itself is not older.
     */
    public static AgeClassification classify(String name, LocalDate cutoff) {
        return extractDate(name)
            .map(date -> date.isBefore(cutoff) ? AgeClassification.OLDER : AgeClassification.NOT_OLDER)
            .orElse(AgeClassification.UNPARSEABLE);
    }

    public static LocalDate cutoff(Clock clock, int days) {
        return LocalDate.now(clock).minusDays(days);
    }

    /**
     * Keeps the names dated before {@code cutoff}, preserving their order.  Names without a date are
     * logged and dropped.
     *
     * @param kind what the names are, for the warning, e.g. {@link #DATA_STREAM_KIND}
     */
    public static List<String> filterOlderThan(Collection<String> names, LocalDate cutoff, String kind) {
        var older = new ArrayList<String>();
        for (var name : names) {
            switch (classify(name, cutoff)) {
                case OLDER:
                    older.add(name);
                    break;
                case UNPARSEABLE:
                    log.warn("Could not parse date from {} name: {}", kind, name);
                    break;
                default:
                    break;
            }
        }
        return older;
    }
}
